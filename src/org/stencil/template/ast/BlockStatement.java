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

import java.util.List;
import org.stencil.template.Position;

/**
 * {{#foo}} ... {{else}} ... {{/foo}}, {{^foo}} ... {{/foo}} or a raw block
 * {{{{foo}}}} ... {{{{/foo}}}}.
 */
public class BlockStatement extends Statement {

  public final PathExpression path;
  public final List<Expression> params;

  /** Null if there is no hash. */
  public final Hash hash;

  /** Null if the block has no body, e.g. {{^foo}} without an else. */
  public final Program program;

  /** Null if the block has no inverse. */
  public final Program inverse;

  public final StripFlags openStrip;
  public final StripFlags inverseStrip;

  /** Mutable because a chain of else blocks shares the close of the outermost block. */
  public StripFlags closeStrip;

  public BlockStatement(Position position, PathExpression path, List<Expression> params,
      Hash hash, Program program, Program inverse, StripFlags openStrip, StripFlags inverseStrip,
      StripFlags closeStrip) {
    super(position);
    this.path = path;
    this.params = params;
    this.hash = hash;
    this.program = program;
    this.inverse = inverse;
    this.openStrip = openStrip;
    this.inverseStrip = inverseStrip;
    this.closeStrip = closeStrip;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitBlock(this);
  }

}
