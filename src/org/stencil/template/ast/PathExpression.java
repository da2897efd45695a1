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
 * foo, foo.bar, ../foo, this, @index or @../key.
 */
public class PathExpression extends Expression {

  /** Whether the path resolves in the private data frame. */
  public final boolean data;

  /** Number of leading ../ segments. */
  public final int depth;

  /** Segments to look up, without this, . or ../ and with [] removed. Empty for "this". */
  public final List<String> parts;

  /** The path as written. */
  public final String original;

  // Whether the path was written with this, ./ or ../ in front.
  private final boolean scoped;

  public PathExpression(Position position, boolean data, int depth, List<String> parts,
      String original, boolean scoped) {
    super(position);
    this.data = data;
    this.depth = depth;
    this.parts = Collections.unmodifiableList(parts);
    this.original = original;
    this.scoped = scoped;
  }

  /**
   * Whether the path is a single bare identifier, and can therefore name a helper.
   */
  public boolean isHelperCandidate() {
    return !data && !scoped && depth == 0 && parts.size() == 1;
  }

  public boolean isScoped() {
    return scoped;
  }

  /** The first segment, or "" for "this". */
  public String head() {
    return parts.isEmpty() ? "" : parts.get(0);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitPath(this);
  }

}
