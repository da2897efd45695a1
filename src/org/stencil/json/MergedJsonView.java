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

package org.stencil.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An OBJECT whose keys come from an overlay first and then from a base view, if the base is an
 * object.
 */
public class MergedJsonView extends JsonViewImpl {

  private final Map<String, JsonView> overlay;
  private final JsonView base;

  public MergedJsonView(Map<String, JsonView> overlay, JsonView base) {
    this.overlay = Collections.unmodifiableMap(new LinkedHashMap<String, JsonView>(overlay));
    this.base = base;
  }

  @Override
  public Type getType() {
    return Type.OBJECT;
  }

  @Override
  public <E> E asInstance(Class<E> clazz) {
    return base == null ? null : base.asInstance(clazz);
  }

  @Override
  public int length() {
    final int[] count = {overlay.size()};
    if (hasObjectBase()) {
      base.asObjectForeach(new ObjectVisitor() {
        @Override
        public void visit(String key, JsonView value) {
          if (!overlay.containsKey(key))
            count[0]++;
        }
      });
    }
    return count[0];
  }

  @Override
  public boolean asObjectIsEmpty() {
    return overlay.isEmpty() && (!hasObjectBase() || base.asObjectIsEmpty());
  }

  @Override
  public void asObjectForeach(final ObjectVisitor visitor) {
    for (Map.Entry<String, JsonView> entry : overlay.entrySet())
      visitor.visit(entry.getKey(), entry.getValue());
    if (hasObjectBase()) {
      base.asObjectForeach(new ObjectVisitor() {
        @Override
        public void visit(String key, JsonView value) {
          if (!overlay.containsKey(key))
            visitor.visit(key, value);
        }
      });
    }
  }

  @Override
  public JsonView get(String key) {
    JsonView value = overlay.get(key);
    if (value != null)
      return value;
    return base == null ? null : base.get(key);
  }

  private boolean hasObjectBase() {
    return base != null && base.getType() == Type.OBJECT;
  }

}
