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

/** (helper param key=value) */
public class SubExpression extends Expression {

  public final PathExpression path;
  public final List<Expression> params;

  /** Null if there is no hash. */
  public final Hash hash;

  public SubExpression(Position position, PathExpression path, List<Expression> params,
      Hash hash) {
    super(position);
    this.path = path;
    this.params = params;
    this.hash = hash;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSubExpression(this);
  }

}
