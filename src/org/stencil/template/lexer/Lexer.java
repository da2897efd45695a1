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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template source into {@link Token}s, one at a time and on demand.
 *
 * The lexer is either scanning content (text between mustaches), an expression (between a
 * mustache's delimiters) or the verbatim body of a raw block. Once the input is exhausted it
 * returns EOF forever; after an error it returns that ERROR token forever.
 */
public class Lexer {

  /** Characters which can't appear in an identifier. */
  static final String UNALLOWED_ID_CHARS = " \t\r\n!\"#%&'()*+,./;<=>@[\\]^`{|}~";

  private static final String OPEN_MUSTACHE = "{{";
  private static final String OPEN_RAW = "{{{{";
  private static final String OPEN_END_RAW = "{{{{/";
  private static final String CLOSE_RAW = "}}}}";

  private static final Pattern OPEN_COMMENT_DASH = Pattern.compile("\\{\\{~?!--");
  private static final Pattern CLOSE_COMMENT_DASH = Pattern.compile("--~?\\}\\}");
  private static final Pattern OPEN_COMMENT = Pattern.compile("\\{\\{~?!");
  private static final Pattern CLOSE_COMMENT = Pattern.compile("~?\\}\\}");

  /** Opening delimiters, in order of precedence. The raw block opener is checked first. */
  private static final Object[][] OPENERS = {
    {TokenKind.OPEN_UNESCAPED, Pattern.compile("\\{\\{~?\\{")},
    {TokenKind.OPEN_BLOCK, Pattern.compile("\\{\\{~?#")},
    {TokenKind.OPEN_END_BLOCK, Pattern.compile("\\{\\{~?/")},
    {TokenKind.OPEN_PARTIAL, Pattern.compile("\\{\\{~?>")},
    {TokenKind.INVERSE, Pattern.compile("\\{\\{~?\\^\\s*~?\\}\\}|\\{\\{~?\\s*else\\s*~?\\}\\}")},
    {TokenKind.OPEN_INVERSE, Pattern.compile("\\{\\{~?\\^")},
    {TokenKind.OPEN_INVERSE_CHAIN, Pattern.compile("\\{\\{~?\\s*else(?=[\\s~}])")},
    {TokenKind.OPEN, Pattern.compile("\\{\\{~?&?")},
  };

  private static final Pattern CLOSE = Pattern.compile("~?\\}\\}");
  private static final Pattern CLOSE_UNESCAPED = Pattern.compile("\\}~?\\}\\}");
  private static final Pattern OPEN_BLOCK_PARAMS = Pattern.compile("as\\s+\\|");
  private static final Pattern BOOLEAN = Pattern.compile("(?:true|false)(?=[=~}\\s/.)|])");
  private static final Pattern DOT_ID = Pattern.compile("\\.(?=[=~}\\s/.)|])");

  private enum Mode {
    CONTENT,
    EXPRESSION,
    RAW,
    DONE
  }

  private final String input;
  private final int[] lineStarts;

  private int pos = 0;
  private Mode mode = Mode.CONTENT;

  // The opening delimiter of the expression being scanned, which decides how it can be closed.
  private TokenKind openKind = null;
  private int openPos = 0;

  private TokenKind previousKind = null;
  private Token terminal = null;
  private final Deque<Token> pending = new ArrayDeque<Token>();

  public Lexer(String input) {
    this.input = input;
    List<Integer> starts = new ArrayList<Integer>();
    starts.add(0);
    for (int i = 0; i < input.length(); i++) {
      if (input.charAt(i) == '\n')
        starts.add(i + 1);
    }
    this.lineStarts = new int[starts.size()];
    for (int i = 0; i < lineStarts.length; i++)
      lineStarts[i] = starts.get(i);
  }

  /** Lexes all of {@code input}, up to and including the terminal EOF or ERROR token. */
  public static List<Token> tokenize(String input) {
    Lexer lexer = new Lexer(input);
    List<Token> tokens = new ArrayList<Token>();
    Token token;
    do {
      token = lexer.nextToken();
      tokens.add(token);
    } while (token.kind != TokenKind.EOF && token.kind != TokenKind.ERROR);
    return tokens;
  }

  public Token nextToken() {
    while (pending.isEmpty() && terminal == null) {
      switch (mode) {
        case CONTENT:
          lexContent();
          break;
        case EXPRESSION:
          lexExpression();
          break;
        case RAW:
          lexRaw();
          break;
        default:
          throw new IllegalStateException("Lexer in mode " + mode + " without a terminal token");
      }
    }
    return pending.isEmpty() ? terminal : pending.removeFirst();
  }

  //
  // Content.
  //

  private void lexContent() {
    int contentStart = pos;
    StringBuilder buf = new StringBuilder();

    while (true) {
      int open = input.indexOf(OPEN_MUSTACHE, pos);
      if (open < 0) {
        buf.append(input, pos, input.length());
        pos = input.length();
        emitContent(buf, contentStart);
        emitTerminal(TokenKind.EOF, pos, "");
        return;
      }

      boolean escaped = open > pos && input.charAt(open - 1) == '\\';
      boolean doubleEscaped = escaped && open - 1 > pos && input.charAt(open - 2) == '\\';

      if (escaped && !doubleEscaped) {
        // \{{ is literal, along with any further braces.
        buf.append(input, pos, open - 1);
        pos = open;
        while (pos < input.length() && input.charAt(pos) == '{')
          buf.append(input.charAt(pos++));
        continue;
      }

      // \\{{ is a literal backslash followed by a real mustache.
      buf.append(input, pos, doubleEscaped ? open - 1 : open);
      pos = open;
      emitContent(buf, contentStart);
      lexOpen();
      return;
    }
  }

  private void lexOpen() {
    if (lookingAt(OPEN_COMMENT_DASH) != null) {
      lexComment(CLOSE_COMMENT_DASH);
      return;
    }
    if (lookingAt(OPEN_COMMENT) != null) {
      lexComment(CLOSE_COMMENT);
      return;
    }

    if (input.startsWith(OPEN_RAW, pos)) {
      beginExpression(TokenKind.OPEN_RAW_BLOCK, OPEN_RAW);
      return;
    }

    for (Object[] opener : OPENERS) {
      TokenKind kind = (TokenKind) opener[0];
      String text = lookingAt((Pattern) opener[1]);
      if (text == null)
        continue;
      if (kind == TokenKind.INVERSE) {
        emit(kind, pos, text);
        pos += text.length();
      } else {
        beginExpression(kind, text);
      }
      return;
    }

    throw new IllegalStateException("No opening delimiter at " + pos);
  }

  private void lexComment(Pattern close) {
    Matcher matcher = close.matcher(input);
    if (!matcher.find(pos)) {
      emitTerminal(TokenKind.ERROR, pos, "Unclosed comment");
      return;
    }
    emit(TokenKind.COMMENT, pos, input.substring(pos, matcher.end()));
    pos = matcher.end();
  }

  private void beginExpression(TokenKind kind, String text) {
    emit(kind, pos, text);
    openKind = kind;
    openPos = pos;
    pos += text.length();
    mode = Mode.EXPRESSION;
  }

  //
  // Raw block bodies.
  //

  private void lexRaw() {
    int depth = 0;
    int from = pos;
    while (true) {
      int open = input.indexOf(OPEN_RAW, from);
      if (open < 0) {
        emitTerminal(TokenKind.ERROR, pos, "Unclosed raw block");
        return;
      }
      if (input.startsWith(OPEN_END_RAW, open)) {
        if (depth == 0) {
          emitContent(new StringBuilder(input.substring(pos, open)), pos);
          pos = open;
          beginExpression(TokenKind.OPEN_END_RAW_BLOCK, OPEN_END_RAW);
          return;
        }
        depth--;
      } else {
        depth++;
      }
      from = open + OPEN_RAW.length();
    }
  }

  //
  // Expressions.
  //

  private void lexExpression() {
    while (pos < input.length() && isIgnorable(input.charAt(pos)))
      pos++;

    if (pos >= input.length()) {
      emitTerminal(TokenKind.ERROR, openPos, "Unclosed expression");
      return;
    }

    if (lexClose())
      return;

    String text = lookingAt(OPEN_BLOCK_PARAMS);
    if (text != null) {
      emitAndAdvance(TokenKind.OPEN_BLOCK_PARAMS, text);
      return;
    }

    text = lookingAt(BOOLEAN);
    if (text != null) {
      emitAndAdvance(TokenKind.BOOLEAN, text);
      return;
    }

    char c = input.charAt(pos);
    switch (c) {
      case '(':
        emitAndAdvance(TokenKind.OPEN_SEXPR, "(");
        return;
      case ')':
        emitAndAdvance(TokenKind.CLOSE_SEXPR, ")");
        return;
      case '=':
        emitAndAdvance(TokenKind.EQUALS, "=");
        return;
      case '@':
        emitAndAdvance(TokenKind.DATA, "@");
        return;
      case '|':
        emitAndAdvance(TokenKind.CLOSE_BLOCK_PARAMS, "|");
        return;
      case '"':
      case '\'':
        lexString(c);
        return;
      case '[':
        lexSegmentLiteral();
        return;
      case '/':
        emitAndAdvance(TokenKind.SEP, "/");
        return;
      case '.':
        if (input.startsWith("..", pos)) {
          emitAndAdvance(TokenKind.ID, "..");
        } else if (lookingAt(DOT_ID) != null) {
          emitAndAdvance(TokenKind.ID, ".");
        } else {
          emitAndAdvance(TokenKind.SEP, ".");
        }
        return;
      default:
        break;
    }

    if (isDigit(c) && previousKind == TokenKind.SEP) {
      // A path segment such as the 0 in foo.0.bar.
      lexIdentifier();
    } else if (isDigit(c) || ((c == '-' || c == '+') && isDigit(charAt(pos + 1)))) {
      lexNumber();
    } else if (UNALLOWED_ID_CHARS.indexOf(c) < 0) {
      lexIdentifier();
    } else {
      emitTerminal(TokenKind.ERROR, pos, "Unexpected character in expression: '" + c + "'");
    }
  }

  private boolean lexClose() {
    if (openKind == TokenKind.OPEN_RAW_BLOCK || openKind == TokenKind.OPEN_END_RAW_BLOCK) {
      if (input.startsWith(CLOSE_RAW, pos)) {
        emitAndAdvance(TokenKind.CLOSE_RAW_BLOCK, CLOSE_RAW);
        mode = (openKind == TokenKind.OPEN_RAW_BLOCK) ? Mode.RAW : Mode.CONTENT;
        openKind = null;
        return true;
      }
    }

    String text = (openKind == TokenKind.OPEN_UNESCAPED) ? lookingAt(CLOSE_UNESCAPED) : null;
    if (text != null) {
      emitAndAdvance(TokenKind.CLOSE_UNESCAPED, text);
    } else if ((text = lookingAt(CLOSE)) != null) {
      emitAndAdvance(TokenKind.CLOSE, text);
    } else {
      return false;
    }
    mode = Mode.CONTENT;
    openKind = null;
    return true;
  }

  private void lexString(char delimiter) {
    int start = pos;
    StringBuilder buf = new StringBuilder();
    int i = pos + 1;
    while (true) {
      char c = charAt(i);
      if (c == 0 || c == '\n') {
        emitTerminal(TokenKind.ERROR, start, "Unterminated string");
        return;
      }
      if (c == delimiter)
        break;
      if (c == '\\') {
        char escaped = charAt(i + 1);
        if (escaped == 0 || escaped == '\n') {
          emitTerminal(TokenKind.ERROR, start, "Unterminated string");
          return;
        }
        if (escaped == delimiter) {
          buf.append(delimiter);
        } else {
          buf.append(c).append(escaped);
        }
        i += 2;
        continue;
      }
      buf.append(c);
      i++;
    }
    emit(TokenKind.STRING, start, buf.toString());
    pos = i + 1;
  }

  private void lexSegmentLiteral() {
    int close = input.indexOf(']', pos);
    if (close < 0) {
      emitTerminal(TokenKind.ERROR, pos, "Unclosed segment literal");
      return;
    }
    emitAndAdvance(TokenKind.ID, input.substring(pos, close + 1));
  }

  private void lexNumber() {
    int start = pos;
    int i = pos;
    if (charAt(i) == '+' || charAt(i) == '-')
      i++;

    String digits = "0123456789";
    if (charAt(i) == '0' && (charAt(i + 1) == 'x' || charAt(i + 1) == 'X')) {
      digits = "0123456789abcdefABCDEF";
      i += 2;
    }
    i = acceptRun(i, digits);
    if (charAt(i) == '.')
      i = acceptRun(i + 1, digits);
    if (charAt(i) == 'e' || charAt(i) == 'E') {
      i++;
      if (charAt(i) == '+' || charAt(i) == '-')
        i++;
      i = acceptRun(i, "0123456789");
    }

    char next = charAt(i);
    if (next == '_' || Character.isLetterOrDigit(next)) {
      emitTerminal(TokenKind.ERROR, start,
          "Bad number syntax: '" + input.substring(start, i + 1) + "'");
      return;
    }
    emitAndAdvance(TokenKind.NUMBER, input.substring(start, i));
  }

  private void lexIdentifier() {
    int end = pos;
    while (end < input.length() && UNALLOWED_ID_CHARS.indexOf(input.charAt(end)) < 0)
      end++;
    emitAndAdvance(TokenKind.ID, input.substring(pos, end));
  }

  //
  // Helpers.
  //

  private String lookingAt(Pattern pattern) {
    Matcher matcher = pattern.matcher(input);
    matcher.region(pos, input.length());
    matcher.useTransparentBounds(true);
    return matcher.lookingAt() ? matcher.group() : null;
  }

  private int acceptRun(int i, String valid) {
    while (i < input.length() && valid.indexOf(input.charAt(i)) >= 0)
      i++;
    return i;
  }

  /** The character at {@code i}, or 0 past the end of the input. */
  private char charAt(int i) {
    return i < input.length() ? input.charAt(i) : 0;
  }

  private void emitContent(StringBuilder buf, int start) {
    if (buf.length() > 0)
      emit(TokenKind.CONTENT, start, buf.toString());
  }

  private void emitAndAdvance(TokenKind kind, String text) {
    emit(kind, pos, text);
    pos += text.length();
  }

  private void emit(TokenKind kind, int at, String val) {
    pending.addLast(newToken(kind, at, val));
    previousKind = kind;
  }

  private void emitTerminal(TokenKind kind, int at, String val) {
    terminal = newToken(kind, at, val);
    pending.addLast(terminal);
    mode = Mode.DONE;
  }

  private Token newToken(TokenKind kind, int at, String val) {
    int line = lineOf(at);
    return new Token(kind, at, line + 1, at - lineStarts[line] + 1, val);
  }

  private int lineOf(int offset) {
    int low = 0;
    int high = lineStarts.length - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (lineStarts[mid] <= offset)
        low = mid;
      else
        high = mid - 1;
    }
    return low;
  }

  private static boolean isIgnorable(char c) {
    return c == ' ' || c == '\t' || c == '\r' || c == '\n';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

}
