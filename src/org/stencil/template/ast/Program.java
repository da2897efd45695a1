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

import java.util.Collections;
import java.util.List;
import org.stencil.template.Position;

/**
 * A sequence of statements: a whole template, or the body or inverse of a block.
 */
public class Program extends Node {

  public final List<Statement> body;

  /** Names declared with as |a b|, empty if there are none. */
  public final List<String> blockParams;

  /** Whether this program only wraps the block of an {{else foo}} chain. */
  public final boolean chained;

  // Set once whitespace control has run over this (root) program.
  private boolean whitespaceProcessed = false;

  public Program(Position position, List<Statement> body, List<String> blockParams,
      boolean chained) {
    super(position);
    this.body = body;
    this.blockParams = blockParams == null
        ? Collections.<String>emptyList()
        : Collections.unmodifiableList(blockParams);
    this.chained = chained;
  }

  public Program(Position position, List<Statement> body) {
    this(position, body, null, false);
  }

  public boolean isWhitespaceProcessed() {
    return whitespaceProcessed;
  }

  public void markWhitespaceProcessed() {
    whitespaceProcessed = true;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitProgram(this);
  }

}
