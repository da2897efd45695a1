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

/** Whether a tag was written with ~ inside its opening and closing delimiters. */
public final class StripFlags {

  public static final StripFlags NONE = new StripFlags(false, false);

  public final boolean open;
  public final boolean close;

  public StripFlags(boolean open, boolean close) {
    this.open = open;
    this.close = close;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof StripFlags))
      return false;
    StripFlags other = (StripFlags) o;
    return open == other.open && close == other.close;
  }

  @Override
  public int hashCode() {
    return (open ? 2 : 0) + (close ? 1 : 0);
  }

  @Override
  public String toString() {
    return (open ? "~" : "") + "|" + (close ? "~" : "");
  }

}
