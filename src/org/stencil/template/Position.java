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

package org.stencil.template;

/**
 * A location in template source. Lines and columns are 1-based, the offset is 0-based.
 */
public final class Position {

  private final int offset;
  private final int line;
  private final int column;

  public Position(int offset, int line, int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public int getOffset() {
    return offset;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Position))
      return false;
    Position other = (Position) o;
    return offset == other.offset && line == other.line && column == other.column;
  }

  @Override
  public int hashCode() {
    return (offset * 31 + line) * 31 + column;
  }

  @Override
  public String toString() {
    return "line " + line + ", column " + column;
  }

}
