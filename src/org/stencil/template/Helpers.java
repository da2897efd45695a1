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
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.json.JsonView;
import org.stencil.json.PojoJsonView;

/**
 * The helpers every template starts with: if, unless, with, each, lookup and log.
 */
public class Helpers {

  private static final Logger LOG = LoggerFactory.getLogger(Helpers.class);

  private Helpers() {}

  /** {{#if cond}}...{{else}}...{{/if}}, where includeZero=true makes 0 true. */
  public static final Helper IF = new Helper() {
    @Override
    public Object apply(Options options) {
      requireOneParam(options);
      return isTrue(options) ? options.fn() : options.inverse();
    }
  };

  /** {{#unless cond}}...{{else}}...{{/unless}}, the opposite of if. */
  public static final Helper UNLESS = new Helper() {
    @Override
    public Object apply(Options options) {
      requireOneParam(options);
      return isTrue(options) ? options.inverse() : options.fn();
    }
  };

  /**
   * {{#with value as |v|}}...{{/with}}. Any object becomes the context, an empty one included;
   * other values must be truthy.
   */
  public static final Helper WITH = new Helper() {
    @Override
    public Object apply(Options options) {
      requireOneParam(options);
      JsonView value = options.param(0);
      boolean isObject = value != null && value.getType() == JsonView.Type.OBJECT;
      if (!isObject && !Values.isTruthy(value))
        return options.inverse();
      return options.fn(value, null, value);
    }
  };

  /**
   * {{#each values as |value key|}}...{{else}}...{{/each}}, over the elements of an array or the
   * members of an object. Sets @index, @key, @first and @last.
   */
  public static final Helper EACH = new Helper() {
    @Override
    public Object apply(final Options options) {
      if (options.params().isEmpty())
        throw new HelperException("Must pass iterator to #each", options.position());

      JsonView value = options.param(0);
      final StringBuilder buf = new StringBuilder();
      final DataFrame frame = options.data();
      int count = 0;

      if (value != null && value.getType() == JsonView.Type.ARRAY) {
        final int length = value.length();
        value.asArrayForeach(new JsonView.ArrayVisitor() {
          @Override
          public void visit(JsonView element, int index) {
            buf.append(options.fn(element, frame.iteration(index, index, length), element,
                new PojoJsonView(index)));
          }
        });
        count = length;
      } else if (value != null && value.getType() == JsonView.Type.OBJECT) {
        final Map<String, JsonView> members = new LinkedHashMap<String, JsonView>();
        value.asObjectForeach(new JsonView.ObjectVisitor() {
          @Override
          public void visit(String key, JsonView member) {
            members.put(key, member);
          }
        });
        int index = 0;
        for (Map.Entry<String, JsonView> member : members.entrySet()) {
          buf.append(options.fn(member.getValue(),
              frame.iteration(index, member.getKey(), members.size()),
              member.getValue(), new PojoJsonView(member.getKey())));
          index++;
        }
        count = members.size();
      }

      if (count == 0)
        return options.inverse();
      return buf.toString();
    }
  };

  /** (lookup object key), the member of an object named by a value. */
  public static final Helper LOOKUP = new Helper() {
    @Override
    public Object apply(Options options) {
      JsonView object = options.param(0);
      JsonView key = options.param(1);
      if (object == null || key == null || object.isNull())
        return null;
      return object.get(Values.toString(key));
    }
  };

  /**
   * {{log "message" value level="warn"}}, which writes its arguments to the log. The level is
   * one of debug, info, warn or error (or 0 to 3), from the hash, else @level, else info.
   */
  public static final Helper LOG_HELPER = new Helper() {
    @Override
    public Object apply(Options options) {
      StringBuilder message = new StringBuilder();
      for (JsonView param : options.params()) {
        if (message.length() > 0)
          message.append(' ');
        message.append(Values.toString(param));
      }

      JsonView level = options.hashValue("level");
      if (level == null)
        level = options.data("level");
      String levelName = (level == null) ? "info" : Values.toString(level).toLowerCase();

      if (levelName.equals("debug") || levelName.equals("0"))
        LOG.debug("{}", message);
      else if (levelName.equals("warn") || levelName.equals("2"))
        LOG.warn("{}", message);
      else if (levelName.equals("error") || levelName.equals("3"))
        LOG.error("{}", message);
      else
        LOG.info("{}", message);
      return "";
    }
  };

  /** The built-in helpers by name. */
  public static Map<String, Helper> builtins() {
    Map<String, Helper> helpers = new LinkedHashMap<String, Helper>();
    helpers.put("if", IF);
    helpers.put("unless", UNLESS);
    helpers.put("with", WITH);
    helpers.put("each", EACH);
    helpers.put("lookup", LOOKUP);
    helpers.put("log", LOG_HELPER);
    return Collections.unmodifiableMap(helpers);
  }

  private static boolean isTrue(Options options) {
    JsonView condition = options.param(0);
    if (Values.isZero(condition)) {
      JsonView includeZero = options.hashValue("includeZero");
      return includeZero != null && Values.isTruthy(includeZero);
    }
    return Values.isTruthy(condition);
  }

  private static void requireOneParam(Options options) {
    if (options.params().size() != 1) {
      throw new HelperException(
          "#" + options.name() + " requires exactly one argument", options.position());
    }
  }

}
