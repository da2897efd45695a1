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

/** A string, number or boolean written in a template. */
public abstract class Literal extends Expression {

  protected Literal(Position position) {
    super(position);
  }

  /** The literal as a Java value. */
  public abstract Object value();

  /** The literal as text, which is also what it looks up when used as a mustache's path. */
  public abstract String original();

}
