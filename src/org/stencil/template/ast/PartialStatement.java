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

/** {{> foo}}, {{> foo bar}} or {{> (whichPartial) baz=qux}} */
public class PartialStatement extends Statement {

  /** A {@link PathExpression}, a {@link SubExpression} or a {@link Literal}. */
  public final Expression name;

  /** At most one, the context to render the partial with. */
  public final List<Expression> params;

  /** Null if there is no hash. */
  public final Hash hash;

  public final StripFlags strip;

  /** Indentation of a standalone partial, which is applied to every line it outputs. */
  public String indent = "";

  public PartialStatement(Position position, Expression name, List<Expression> params, Hash hash,
      StripFlags strip) {
    super(position);
    this.name = name;
    this.params = params;
    this.hash = hash;
    this.strip = strip;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitPartial(this);
  }

}
