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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.stencil.json.JsonView;
import org.stencil.json.JsonViews;

/**
 * Private data, read in templates with @-paths such as {@code @index} or {@code @root}.
 *
 * Frames are immutable. Deriving a frame copies this frame's entries into a child which links
 * back to this one, so {@code @../key} can reach the entries of the frame it was derived from.
 */
public final class DataFrame {

  private final DataFrame parent;
  private final Map<String, JsonView> data;

  public DataFrame() {
    this(null, Collections.<String, JsonView>emptyMap());
  }

  private DataFrame(DataFrame parent, Map<String, JsonView> data) {
    this.parent = parent;
    this.data = Collections.unmodifiableMap(data);
  }

  /** A root frame holding {@code values}. */
  public static DataFrame of(Map<String, ?> values) {
    return new DataFrame().with(values).detach();
  }

  /** A child frame with the same entries. */
  public DataFrame copy() {
    return new DataFrame(this, new LinkedHashMap<String, JsonView>(data));
  }

  /** A child frame with the same entries plus {@code key}. */
  public DataFrame with(String key, Object value) {
    Map<String, JsonView> copy = new LinkedHashMap<String, JsonView>(data);
    copy.put(key, JsonViews.of(value));
    return new DataFrame(this, copy);
  }

  /** A child frame with the same entries plus {@code values}. */
  public DataFrame with(Map<String, ?> values) {
    Map<String, JsonView> copy = new LinkedHashMap<String, JsonView>(data);
    for (Map.Entry<String, ?> entry : values.entrySet())
      copy.put(entry.getKey(), JsonViews.of(entry.getValue()));
    return new DataFrame(this, copy);
  }

  /** The child frame for one iteration of a loop over {@code length} elements. */
  public DataFrame iteration(int index, Object key, int length) {
    Map<String, JsonView> copy = new LinkedHashMap<String, JsonView>(data);
    copy.put("index", JsonViews.of(index));
    copy.put("key", JsonViews.of(key));
    copy.put("first", JsonViews.of(index == 0));
    copy.put("last", JsonViews.of(index == length - 1));
    return new DataFrame(this, copy);
  }

  /** Returns null if there is no such entry. */
  public JsonView get(String key) {
    return data.get(key);
  }

  /** Looks up {@code parts[0]} and then each further part within it. */
  public JsonView find(List<String> parts) {
    if (parts.isEmpty())
      return null;
    JsonView value = data.get(parts.get(0));
    for (int i = 1; i < parts.size() && value != null; i++)
      value = value.get(parts.get(i));
    return value;
  }

  /** The frame this one was derived from, or null for a root frame. */
  public DataFrame getParent() {
    return parent;
  }

  public Set<String> keys() {
    return data.keySet();
  }

  private DataFrame detach() {
    return new DataFrame(null, new LinkedHashMap<String, JsonView>(data));
  }

  @Override
  public String toString() {
    return "DataFrame" + data;
  }

}
