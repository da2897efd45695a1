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

package org.stencil.template.lexer;

/**
 * The kinds of token the {@link Lexer} produces.
 */
public enum TokenKind {
  ERROR,
  EOF,

  // Delimiters.
  OPEN,
  CLOSE,
  OPEN_RAW_BLOCK,
  CLOSE_RAW_BLOCK,
  OPEN_END_RAW_BLOCK,
  OPEN_UNESCAPED,
  CLOSE_UNESCAPED,
  OPEN_BLOCK,
  OPEN_END_BLOCK,
  INVERSE,
  OPEN_INVERSE,
  OPEN_INVERSE_CHAIN,
  OPEN_PARTIAL,
  COMMENT,

  // Inside a mustache.
  OPEN_SEXPR,
  CLOSE_SEXPR,
  EQUALS,
  DATA,
  SEP,
  OPEN_BLOCK_PARAMS,
  CLOSE_BLOCK_PARAMS,

  // Tokens with a value.
  CONTENT,
  ID,
  STRING,
  NUMBER,
  BOOLEAN
}
