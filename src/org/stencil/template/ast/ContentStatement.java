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

/** Literal text. */
public class ContentStatement extends Statement {

  /** The text as written in the source. */
  public final String original;

  /** The text to output, after whitespace control. */
  public String value;

  public boolean leftStripped = false;
  public boolean rightStripped = false;

  public ContentStatement(Position position, String original) {
    super(position);
    this.original = original;
    this.value = original;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitContent(this);
  }

}
