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

/** {{! foo }} or {{!-- foo --}} */
public class CommentStatement extends Statement {

  public final String value;
  public final StripFlags strip;

  public CommentStatement(Position position, String value, StripFlags strip) {
    super(position);
    this.value = value;
    this.strip = strip;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitComment(this);
  }

}
