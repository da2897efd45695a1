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
 * Thrown when template source can't be split into tokens: an unterminated string, comment or
 * expression, or a character which isn't allowed.
 */
public class LexException extends ParseException {

  private static final long serialVersionUID = 1L;

  public LexException(String message, Position position) {
    super(message, position);
  }

}
