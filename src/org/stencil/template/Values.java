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

import org.stencil.json.JsonView;
import org.stencil.json.JsonViews;

/**
 * Static helpers for looking at template values: truthiness, stringification and escaping.
 */
public class Values {

  private Values() {}

  /**
   * Whether a value counts as true in a condition. Undefined (null), null, false, "", 0, and empty
   * arrays and objects are false; everything else is true.
   */
  public static boolean isTruthy(JsonView value) {
    if (value == null)
      return false;
    switch (value.getType()) {
      case NULL:
        return false;
      case BOOLEAN:
        return value.asBoolean();
      case NUMBER:
        return !isZero(value) && !Double.isNaN(value.asNumber().doubleValue());
      case STRING:
        return !value.asString().isEmpty();
      case ARRAY:
        return !value.asArrayIsEmpty();
      case OBJECT:
        return !value.asObjectIsEmpty();
      default:
        throw new UnsupportedOperationException("Unknown type " + value.getType());
    }
  }

  public static boolean isZero(JsonView value) {
    return value != null &&
        value.getType() == JsonView.Type.NUMBER &&
        value.asNumber().doubleValue() == 0;
  }

  /**
   * The text a value renders as. Undefined and null render as nothing, arrays as their elements
   * one after the other.
   */
  public static String toString(JsonView value) {
    if (value == null)
      return "";
    switch (value.getType()) {
      case NULL:
        return "";
      case BOOLEAN:
        return Boolean.toString(value.asBoolean());
      case NUMBER:
        return JsonViews.formatNumber(value.asNumber());
      case STRING:
        return value.asString();
      case ARRAY:
        final StringBuilder buf = new StringBuilder();
        value.asArrayForeach(new JsonView.ArrayVisitor() {
          @Override
          public void visit(JsonView element, int index) {
            buf.append(Values.toString(element));
          }
        });
        return buf.toString();
      default:
        return value.toString();
    }
  }

  /** Whether a value was marked as already escaped. */
  public static boolean isSafe(JsonView value) {
    return value != null && value.asInstance(SafeString.class) != null;
  }

  /** Escapes &amp; &lt; &gt; " ' and ` for HTML. */
  public static String escapeHtml(String unescaped) {
    StringBuilder escaped = null;
    for (int i = 0; i < unescaped.length(); i++) {
      String replacement;
      char c = unescaped.charAt(i);
      switch (c) {
        case '&': replacement = "&amp;"; break;
        case '<': replacement = "&lt;"; break;
        case '>': replacement = "&gt;"; break;
        case '"': replacement = "&quot;"; break;
        case '\'': replacement = "&#x27;"; break;
        case '`': replacement = "&#x60;"; break;
        default: replacement = null;
      }
      if (replacement != null && escaped == null)
        escaped = new StringBuilder(unescaped.substring(0, i));
      if (escaped != null) {
        if (replacement != null)
          escaped.append(replacement);
        else
          escaped.append(c);
      }
    }
    return escaped == null ? unescaped : escaped.toString();
  }

}
