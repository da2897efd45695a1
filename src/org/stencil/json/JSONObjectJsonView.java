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

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A JSON view of an org.json document.
 *
 * @author kalman
 *
 */
public class JSONObjectJsonView extends JsonViewImpl {

  /**
   * The array counterpart. Indices and "length" can be looked up with {@link #get(String)}.
   */
  public static class JSONArrayJsonView extends JsonViewImpl {
    private final JSONArray array;

    public JSONArrayJsonView(JSONArray array) {
      this.array = array;
    }

    @Override
    public Type getType() {
      return Type.ARRAY;
    }

    @Override
    public <E> E asInstance(Class<E> clazz) {
      return clazz.isInstance(array) ? clazz.cast(array) : null;
    }

    @Override
    public int length() {
      return array.length();
    }

    @Override
    public boolean asArrayIsEmpty() {
      return array.length() == 0;
    }

    @Override
    public void asArrayForeach(ArrayVisitor visitor) {
      for (int i = 0, length = array.length(); i < length; i++)
        visitor.visit(JsonViews.of(array.opt(i)), i);
    }

    @Override
    public JsonView get(String key) {
      if ("length".equals(key))
        return new PojoJsonView(array.length());
      int index;
      try {
        index = Integer.parseInt(key);
      } catch (NumberFormatException e) {
        return null;
      }
      if (index < 0 || index >= array.length())
        return null;
      return JsonViews.of(array.opt(index));
    }

    @Override
    public String toString() {
      return array.toString();
    }
  }

  private final JSONObject json;

  public JSONObjectJsonView(JSONObject json) {
    this.json = json;
  }

  @Override
  public Type getType() {
    return Type.OBJECT;
  }

  @Override
  public <E> E asInstance(Class<E> clazz) {
    return clazz.isInstance(json) ? clazz.cast(json) : null;
  }

  @Override
  public int length() {
    return json.length();
  }

  @Override
  public boolean asObjectIsEmpty() {
    return json.isEmpty();
  }

  @Override
  public void asObjectForeach(ObjectVisitor visitor) {
    for (String key : json.keySet())
      visitor.visit(key, get(key));
  }

  @Override
  public JsonView get(String key) {
    if (!json.has(key))
      return null;
    return JsonViews.of(json.opt(key));
  }

  @Override
  public String toString() {
    return json.toString();
  }

}
