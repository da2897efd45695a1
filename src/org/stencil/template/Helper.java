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
 * A function callable from templates, as {{name args}}, {{#name args}}...{{/name}} or (name args).
 *
 * The result is rendered as text: a {@link SafeString} as-is, anything else escaped when it is
 * the output of an escaping mustache. Block helpers build their result from
 * {@link Options#fn()} and {@link Options#inverse()}. Sub-expressions use the result as a value.
 */
public interface Helper {
  Object apply(Options options);
}
