// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.stencil.template.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints an AST in a stable, indented text form, e.g.
 *
 * <pre>
 * BLOCK:
 *   PATH:foo [PATH:bar]
 *   PROGRAM:
 *     CONTENT[ 'baz' ]
 * </pre>
 *
 * Statements end with a newline; expressions print inline.
 */
public class AstPrinter implements Visitor<String> {

  private int padding = 0;

  public String print(Node node) {
    padding = 0;
    return node.accept(this);
  }

  private String pad(String line) {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < padding; i++)
      buf.append("  ");
    return buf.append(line).append('\n').toString();
  }

  @Override
  public String visitProgram(Program node) {
    StringBuilder buf = new StringBuilder();
    if (!node.blockParams.isEmpty()) {
      StringBuilder params = new StringBuilder("BLOCK PARAMS: [");
      for (String param : node.blockParams)
        params.append(' ').append(param);
      buf.append(pad(params.append(" ]").toString()));
    }
    for (Statement statement : node.body)
      buf.append(statement.accept(this));
    return buf.toString();
  }

  @Override
  public String visitMustache(MustacheStatement node) {
    return pad("{{ " + call(node.path, node.params, node.hash) + " }}");
  }

  @Override
  public String visitBlock(BlockStatement node) {
    StringBuilder buf = new StringBuilder(pad("BLOCK:"));
    padding++;
    buf.append(pad(call(node.path, node.params, node.hash)));
    if (node.program != null) {
      buf.append(pad("PROGRAM:"));
      padding++;
      buf.append(node.program.accept(this));
      padding--;
    }
    if (node.inverse != null) {
      buf.append(pad("{{^}}"));
      padding++;
      buf.append(node.inverse.accept(this));
      padding--;
    }
    padding--;
    return buf.toString();
  }

  @Override
  public String visitPartial(PartialStatement node) {
    StringBuilder content = new StringBuilder("PARTIAL:");
    if (node.name instanceof PathExpression)
      content.append(((PathExpression) node.name).original);
    else if (node.name instanceof Literal)
      content.append(((Literal) node.name).original());
    else
      content.append('(').append(node.name.accept(this)).append(')');
    if (!node.params.isEmpty())
      content.append(' ').append(node.params.get(0).accept(this));
    if (node.hash != null)
      content.append(' ').append(node.hash.accept(this));
    return pad("{{> " + content + " }}");
  }

  @Override
  public String visitContent(ContentStatement node) {
    return pad("CONTENT[ '" + node.value + "' ]");
  }

  @Override
  public String visitComment(CommentStatement node) {
    return pad("{{! '" + node.value + "' }}");
  }

  @Override
  public String visitSubExpression(SubExpression node) {
    return call(node.path, node.params, node.hash);
  }

  @Override
  public String visitPath(PathExpression node) {
    StringBuilder buf = new StringBuilder();
    if (node.data)
      buf.append('@');
    buf.append("PATH:");
    for (int i = 0; i < node.parts.size(); i++) {
      if (i > 0)
        buf.append('/');
      buf.append(node.parts.get(i));
    }
    return buf.toString();
  }

  @Override
  public String visitString(StringLiteral node) {
    return "\"" + node.value + "\"";
  }

  @Override
  public String visitBoolean(BooleanLiteral node) {
    return "BOOLEAN{" + node.value + "}";
  }

  @Override
  public String visitNumber(NumberLiteral node) {
    return "NUMBER{" + node.original + "}";
  }

  @Override
  public String visitHash(Hash node) {
    List<String> pairs = new ArrayList<String>();
    for (Hash.HashPair pair : node.pairs)
      pairs.add(pair.key + "=" + pair.value.accept(this));
    return "HASH{" + String.join(", ", pairs) + "}";
  }

  private String call(Expression path, List<Expression> params, Hash hash) {
    List<String> printed = new ArrayList<String>();
    for (Expression param : params)
      printed.add(param.accept(this));
    String result = path.accept(this) + " [" + String.join(", ", printed) + "]";
    if (hash != null)
      result += " " + hash.accept(this);
    return result;
  }

}
