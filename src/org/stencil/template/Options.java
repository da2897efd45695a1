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
import java.util.List;
import java.util.Map;
import org.stencil.json.JsonView;
import org.stencil.json.JsonViews;
import org.stencil.json.PojoJsonView;
import org.stencil.template.ast.Program;

/**
 * What a {@link Helper} is called with: its evaluated arguments, and for block helpers handles to
 * render the block's body and inverse.
 *
 * Changes a helper makes to the context stack or the private data are undone once it returns.
 */
public class Options {

  private final Evaluator evaluator;
  private final String name;
  private final List<JsonView> params;
  private final Map<String, JsonView> hash;
  private final Program fn;
  private final Program inverse;
  private final Position position;

  Options(Evaluator evaluator, String name, List<JsonView> params, Map<String, JsonView> hash,
      Program fn, Program inverse, Position position) {
    this.evaluator = evaluator;
    this.name = name;
    this.params = Collections.unmodifiableList(params);
    this.hash = Collections.unmodifiableMap(hash);
    this.fn = fn;
    this.inverse = inverse;
    this.position = position;
  }

  /** The name the helper was called by. */
  public String name() {
    return name;
  }

  /** Where the helper was called from. */
  public Position position() {
    return position;
  }

  //
  // Arguments.
  //

  public List<JsonView> params() {
    return params;
  }

  /** The {@code i}th positional argument, or null if there are fewer arguments. */
  public JsonView param(int i) {
    return i < params.size() ? params.get(i) : null;
  }

  /** The {@code i}th positional argument as text. */
  public String paramString(int i) {
    return Values.toString(param(i));
  }

  public Map<String, JsonView> hash() {
    return hash;
  }

  /** The hash argument {@code key}, or null if it wasn't given. */
  public JsonView hashValue(String key) {
    return hash.get(key);
  }

  //
  // Blocks.
  //

  /** Whether the helper was called as a block, {{#name}}...{{/name}}. */
  public boolean isBlock() {
    return fn != null || inverse != null;
  }

  /** Renders the block's body with the current context. */
  public String fn() {
    return fn(context());
  }

  /** Renders the block's body with {@code context}. */
  public String fn(Object context) {
    return fn(context, null);
  }

  /**
   * Renders the block's body with {@code context}, the private data {@code frame} (the current
   * data if null) and values for the block's parameters.
   */
  public String fn(Object context, DataFrame frame, JsonView... blockParams) {
    return evaluator.renderBlockProgram(fn, wrap(context), frame, blockParams);
  }

  /** Renders the block's inverse with the current context. */
  public String inverse() {
    return inverse(context());
  }

  /** Renders the block's inverse with {@code context}. */
  public String inverse(Object context) {
    return evaluator.renderBlockProgram(inverse, wrap(context), null, new JsonView[0]);
  }

  //
  // Context.
  //

  /** The innermost context, i.e. "this". */
  public JsonView context() {
    return evaluator.context();
  }

  public void push(Object context) {
    evaluator.pushContext(wrap(context));
  }

  public JsonView pop() {
    return evaluator.popContext();
  }

  //
  // Private data.
  //

  public DataFrame data() {
    return evaluator.frame();
  }

  /** The private data entry {@code key}, or null if there is none. */
  public JsonView data(String key) {
    return evaluator.frame().get(key);
  }

  /** Sets a private data entry for the rest of this helper call, in a new child frame. */
  public void setData(String key, Object value) {
    evaluator.setFrame(evaluator.frame().with(key, value));
  }

  private static JsonView wrap(Object context) {
    return (context == null) ? new PojoJsonView(null) : JsonViews.of(context);
  }

}
