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

/**
 * Visits every kind of AST node.
 *
 * @param <R> the result of a visit
 */
public interface Visitor<R> {
  R visitProgram(Program node);

  // Statements.
  R visitMustache(MustacheStatement node);
  R visitBlock(BlockStatement node);
  R visitPartial(PartialStatement node);
  R visitContent(ContentStatement node);
  R visitComment(CommentStatement node);

  // Expressions.
  R visitSubExpression(SubExpression node);
  R visitPath(PathExpression node);
  R visitString(StringLiteral node);
  R visitBoolean(BooleanLiteral node);
  R visitNumber(NumberLiteral node);
  R visitHash(Hash node);
}
