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

import org.stencil.template.Position;

/** true or false */
public class BooleanLiteral extends Literal {

  public final boolean value;

  public BooleanLiteral(Position position, boolean value) {
    super(position);
    this.value = value;
  }

  @Override
  public Object value() {
    return value;
  }

  @Override
  public String original() {
    return Boolean.toString(value);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitBoolean(this);
  }

}
