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

import org.stencil.template.Position;

/**
 * An immutable lexical token.
 */
public final class Token {

  public final TokenKind kind;

  /** 0-based offset of the token's first character. */
  public final int pos;

  public final int line;

  public final int column;

  /**
   * The token text. Delimiters keep their strip markers; strings are unquoted; errors carry their
   * message.
   */
  public final String val;

  public Token(TokenKind kind, int pos, int line, int column, String val) {
    this.kind = kind;
    this.pos = pos;
    this.line = line;
    this.column = column;
    this.val = val;
  }

  public Position position() {
    return new Position(pos, line, column);
  }

  /** Whether an opening delimiter is written {{~. */
  public boolean hasLeftStrip() {
    return val.length() >= 3 && val.charAt(2) == '~';
  }

  /** Whether a closing delimiter is written ~}}. */
  public boolean hasRightStrip() {
    return val.length() >= 3 && val.charAt(val.length() - 3) == '~';
  }

  @Override
  public String toString() {
    switch (kind) {
      case EOF:
        return "EOF";
      case ERROR:
        return "ERROR{" + val + "}";
      default:
        return kind + "{'" + val + "'}";
    }
  }

}
