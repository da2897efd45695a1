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

/** key=value pairs, in source order. Keys are unique. */
public class Hash extends Node {

  public static class HashPair {
    public final Position position;
    public final String key;
    public final Expression value;

    public HashPair(Position position, String key, Expression value) {
      this.position = position;
      this.key = key;
      this.value = value;
    }
  }

  public final List<HashPair> pairs;

  public Hash(Position position, List<HashPair> pairs) {
    super(position);
    this.pairs = Collections.unmodifiableList(pairs);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitHash(this);
  }

}
