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

package org.stencil.template;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.json.JsonView;
import org.stencil.json.JsonViews;
import org.stencil.json.MergedJsonView;
import org.stencil.json.PojoJsonView;
import org.stencil.template.ast.BlockStatement;
import org.stencil.template.ast.BooleanLiteral;
import org.stencil.template.ast.CommentStatement;
import org.stencil.template.ast.ContentStatement;
import org.stencil.template.ast.Expression;
import org.stencil.template.ast.Hash;
import org.stencil.template.ast.Literal;
import org.stencil.template.ast.MustacheStatement;
import org.stencil.template.ast.NumberLiteral;
import org.stencil.template.ast.PartialStatement;
import org.stencil.template.ast.PathExpression;
import org.stencil.template.ast.Program;
import org.stencil.template.ast.Statement;
import org.stencil.template.ast.StringLiteral;
import org.stencil.template.ast.SubExpression;
import org.stencil.template.ast.Visitor;

/**
 * Renders a processed AST. One evaluator serves one render call.
 *
 * Statements write to the current output buffer and evaluate to null; expressions evaluate to
 * their value, where null means undefined.
 */
class Evaluator implements Visitor<JsonView> {

  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  private final Handlebar template;
  private final Handlebar.Config config;

  // Innermost first.
  private final Deque<JsonView> contexts = new ArrayDeque<JsonView>();

  // Values of block parameters in scope, innermost first.
  private final Deque<Map<String, JsonView>> blockParams = new ArrayDeque<Map<String, JsonView>>();

  private DataFrame frame;
  private StringBuilder out = new StringBuilder();
  private int partialDepth = 0;

  Evaluator(Handlebar template, JsonView data, DataFrame frame) {
    this.template = template;
    this.config = template.getConfig();
    this.contexts.addFirst(data);
    DataFrame initial = (frame == null) ? new DataFrame() : frame;
    if (initial.get("root") == null)
      initial = initial.with("root", data);
    this.frame = initial;
  }

  String render(Program program) {
    program.accept(this);
    return out.toString();
  }

  //
  // State, for Options.
  //

  JsonView context() {
    return contexts.peekFirst();
  }

  void pushContext(JsonView context) {
    contexts.addFirst(context);
  }

  JsonView popContext() {
    if (contexts.size() <= 1)
      throw new HelperException("Cannot pop the root context");
    return contexts.removeFirst();
  }

  DataFrame frame() {
    return frame;
  }

  void setFrame(DataFrame frame) {
    this.frame = frame;
  }

  /**
   * Renders {@code program} into a new buffer with {@code context} as "this", which is only
   * pushed if it isn't "this" already. Renders nothing if {@code program} is null.
   */
  String renderBlockProgram(Program program, JsonView context, DataFrame withFrame,
      JsonView[] blockParamValues) {
    if (program == null)
      return "";

    StringBuilder savedOut = out;
    DataFrame savedFrame = frame;
    boolean pushed = context != contexts.peekFirst();
    boolean scoped = !program.blockParams.isEmpty();

    out = new StringBuilder();
    if (withFrame != null)
      frame = withFrame;
    if (pushed)
      contexts.addFirst(context);
    if (scoped) {
      Map<String, JsonView> scope = new HashMap<String, JsonView>();
      for (int i = 0; i < program.blockParams.size(); i++) {
        JsonView value = (blockParamValues != null && i < blockParamValues.length)
            ? blockParamValues[i]
            : null;
        scope.put(program.blockParams.get(i), value);
      }
      blockParams.addFirst(scope);
    }

    try {
      program.accept(this);
      return out.toString();
    } finally {
      if (scoped)
        blockParams.removeFirst();
      if (pushed)
        contexts.removeFirst();
      frame = savedFrame;
      out = savedOut;
    }
  }

  //
  // Statements.
  //

  @Override
  public JsonView visitProgram(Program node) {
    for (Statement statement : node.body)
      statement.accept(this);
    return null;
  }

  @Override
  public JsonView visitContent(ContentStatement node) {
    out.append(node.value);
    return null;
  }

  @Override
  public JsonView visitComment(CommentStatement node) {
    return null;
  }

  @Override
  public JsonView visitMustache(MustacheStatement node) {
    JsonView value;
    if (node.path instanceof SubExpression) {
      value = node.path.accept(this);
    } else {
      String name = helperName(node.path);
      Helper helper = findHelper(node.path, name, node.params, node.hash);
      if (helper != null) {
        value = JsonViews.of(callHelper(helper, name, node.params, node.hash, null, null,
            node.position));
      } else if (!node.params.isEmpty() || node.hash != null) {
        throw new HelperException("Missing helper: \"" + name + "\"", node.position);
      } else if (node.path instanceof Literal) {
        value = context().get(((Literal) node.path).original());
      } else {
        value = node.path.accept(this);
      }
    }

    if (value == null || value.isNull())
      return null;
    String text = Values.toString(value);
    if (node.escaped && !config.isNoEscape() && !Values.isSafe(value))
      text = Values.escapeHtml(text);
    out.append(text);
    return null;
  }

  @Override
  public JsonView visitBlock(BlockStatement node) {
    String name = node.path.original;
    Helper helper = findHelper(node.path, name, node.params, node.hash);
    if (helper != null) {
      Object result = callHelper(helper, name, node.params, node.hash, node.program,
          node.inverse, node.position);
      out.append(Values.toString(JsonViews.of(result)));
      return null;
    }
    if (!node.params.isEmpty() || node.hash != null)
      throw new HelperException("Missing helper: \"" + name + "\"", node.position);

    JsonView value = node.path.accept(this);
    if (!Values.isTruthy(value)) {
      out.append(renderBlockProgram(node.inverse, context(), null, null));
    } else if (value.getType() == JsonView.Type.ARRAY) {
      List<JsonView> params = new ArrayList<JsonView>();
      params.add(value);
      Options options = new Options(this, "each", params, new LinkedHashMap<String, JsonView>(),
          node.program, node.inverse, node.position);
      out.append(Values.toString(JsonViews.of(invoke(template.getHelper("each"), options))));
    } else if (value.getType() == JsonView.Type.BOOLEAN) {
      out.append(renderBlockProgram(node.program, context(), null, null));
    } else {
      out.append(renderBlockProgram(node.program, value, null, null));
    }
    return null;
  }

  @Override
  public JsonView visitPartial(PartialStatement node) {
    String name;
    if (node.name instanceof PathExpression)
      name = ((PathExpression) node.name).original;
    else if (node.name instanceof Literal)
      name = ((Literal) node.name).original();
    else
      name = Values.toString(node.name.accept(this));

    Program partial = template.getPartial(name);
    if (partial == null)
      throw new PartialException("The partial " + name + " could not be found", node.position);
    if (partialDepth >= config.getMaxPartialDepth()) {
      throw new PartialException("Partial " + name + " nested more than " +
          config.getMaxPartialDepth() + " levels deep", node.position);
    }

    JsonView context = node.params.isEmpty() ? context() : orNull(node.params.get(0).accept(this));
    DataFrame partialFrame = null;
    if (node.hash != null) {
      Map<String, JsonView> values = evaluateHash(node.hash);
      partialFrame = frame.with(values);
      context = new MergedJsonView(values, context);
    }

    LOG.debug("Rendering partial {} at depth {}", name, partialDepth + 1);
    String rendered;
    Deque<Map<String, JsonView>> savedBlockParams =
        new ArrayDeque<Map<String, JsonView>>(blockParams);
    blockParams.clear();
    partialDepth++;
    try {
      rendered = renderBlockProgram(partial, context, partialFrame, null);
    } finally {
      partialDepth--;
      blockParams.addAll(savedBlockParams);
    }

    out.append(node.indent.isEmpty() ? rendered : indent(rendered, node.indent));
    return null;
  }

  //
  // Expressions.
  //

  @Override
  public JsonView visitSubExpression(SubExpression node) {
    String name = node.path.original;
    Helper helper = node.path.isHelperCandidate() ? template.getHelper(name) : null;
    if (helper == null)
      throw new HelperException("Missing helper: \"" + name + "\"", node.position);
    return JsonViews.of(callHelper(helper, name, node.params, node.hash, null, null,
        node.position));
  }

  @Override
  public JsonView visitPath(PathExpression node) {
    if (node.data) {
      DataFrame target = frame;
      for (int i = 0; i < node.depth && target != null; i++)
        target = target.getParent();
      return (target == null) ? null : target.find(node.parts);
    }

    if (!node.isScoped() && !node.parts.isEmpty()) {
      for (Map<String, JsonView> scope : blockParams) {
        if (scope.containsKey(node.head()))
          return walk(scope.get(node.head()), node.parts, 1);
      }
    }

    if (node.depth >= contexts.size()) {
      throw new ResolutionException("Path " + node.original + " goes up " + node.depth +
          " contexts but there are only " + contexts.size(), node.position);
    }
    Iterator<JsonView> it = contexts.iterator();
    for (int i = 0; i < node.depth; i++)
      it.next();
    return walk(it.next(), node.parts, 0);
  }

  @Override
  public JsonView visitString(StringLiteral node) {
    return JsonViews.of(node.value);
  }

  @Override
  public JsonView visitBoolean(BooleanLiteral node) {
    return JsonViews.of(node.value);
  }

  @Override
  public JsonView visitNumber(NumberLiteral node) {
    return JsonViews.of(node.value);
  }

  @Override
  public JsonView visitHash(Hash node) {
    return JsonViews.of(evaluateHash(node));
  }

  //
  // Helpers.
  //

  /**
   * The helper a mustache or block calls, if any. A registered name is a helper call when there
   * are arguments, or when "this" has no field of that name.
   */
  private Helper findHelper(Expression path, String name, List<Expression> params, Hash hash) {
    boolean candidate = (path instanceof PathExpression)
        ? ((PathExpression) path).isHelperCandidate()
        : path instanceof Literal;
    if (!candidate)
      return null;
    Helper helper = template.getHelper(name);
    if (helper == null)
      return null;
    if (!params.isEmpty() || hash != null)
      return helper;
    return isField(name) ? null : helper;
  }

  private boolean isField(String name) {
    for (Map<String, JsonView> scope : blockParams) {
      if (scope.containsKey(name))
        return true;
    }
    JsonView context = context();
    return context != null && context.get(name) != null;
  }

  private Object callHelper(Helper helper, String name, List<Expression> params, Hash hash,
      Program fn, Program inverse, Position position) {
    List<JsonView> values = new ArrayList<JsonView>();
    for (Expression param : params)
      values.add(orNull(param.accept(this)));
    Map<String, JsonView> hashValues = (hash == null)
        ? new LinkedHashMap<String, JsonView>()
        : evaluateHash(hash);
    return invoke(helper, new Options(this, name, values, hashValues, fn, inverse, position));
  }

  private Object invoke(Helper helper, Options options) {
    int depth = contexts.size();
    DataFrame savedFrame = frame;
    try {
      return helper.apply(options);
    } catch (TemplateException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new HelperException(
          "Helper \"" + options.name() + "\" failed: " + e.getMessage(), options.position(), e);
    } finally {
      while (contexts.size() > depth)
        contexts.removeFirst();
      frame = savedFrame;
    }
  }

  private Map<String, JsonView> evaluateHash(Hash hash) {
    Map<String, JsonView> values = new LinkedHashMap<String, JsonView>();
    for (Hash.HashPair pair : hash.pairs)
      values.put(pair.key, orNull(pair.value.accept(this)));
    return values;
  }

  private static String helperName(Expression path) {
    if (path instanceof PathExpression)
      return ((PathExpression) path).original;
    return ((Literal) path).original();
  }

  private static JsonView walk(JsonView value, List<String> parts, int from) {
    for (int i = from; i < parts.size() && value != null; i++)
      value = value.get(parts.get(i));
    return value;
  }

  private static JsonView orNull(JsonView value) {
    return (value == null) ? new PojoJsonView(null) : value;
  }

  /** Prefixes every line of {@code text} with {@code indent}, except a final empty line. */
  private static String indent(String text, String indent) {
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].isEmpty() && i + 1 == lines.length)
        break;
      lines[i] = indent + lines[i];
    }
    return String.join("\n", lines);
  }

}
