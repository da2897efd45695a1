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

import java.math.BigDecimal;
import java.math.BigInteger;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Static factory for {@link JsonView}s.
 */
public class JsonViews {

  private JsonViews() {}

  /**
   * Wraps any value in the view that suits it. Views are returned unchanged, org.json values get
   * org.json views and everything else is viewed as a plain Java object.
   */
  public static JsonView of(Object value) {
    if (value instanceof JsonView)
      return (JsonView) value;
    if (value instanceof JSONObject)
      return new JSONObjectJsonView((JSONObject) value);
    if (value instanceof JSONArray)
      return new JSONObjectJsonView.JSONArrayJsonView((JSONArray) value);
    if (value == JSONObject.NULL)
      return new PojoJsonView(null);
    return new PojoJsonView(value);
  }

  /**
   * Formats a number the way a template prints it: integral values without a fraction, others
   * without trailing zeros or an exponent.
   */
  public static String formatNumber(Number number) {
    if (number instanceof Integer || number instanceof Long ||
        number instanceof Short || number instanceof Byte ||
        number instanceof BigInteger)
      return number.toString();
    if (number instanceof BigDecimal)
      return ((BigDecimal) number).stripTrailingZeros().toPlainString();

    double d = number.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d))
      return Double.toString(d);
    if (d == Math.rint(d) && Math.abs(d) < 1e15)
      return Long.toString((long) d);
    return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
  }

}
