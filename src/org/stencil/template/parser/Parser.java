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

package org.stencil.template.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.template.LexException;
import org.stencil.template.ParseException;
import org.stencil.template.Position;
import org.stencil.template.ast.BlockStatement;
import org.stencil.template.ast.BooleanLiteral;
import org.stencil.template.ast.CommentStatement;
import org.stencil.template.ast.ContentStatement;
import org.stencil.template.ast.Expression;
import org.stencil.template.ast.Hash;
import org.stencil.template.ast.MustacheStatement;
import org.stencil.template.ast.NumberLiteral;
import org.stencil.template.ast.PartialStatement;
import org.stencil.template.ast.PathExpression;
import org.stencil.template.ast.Program;
import org.stencil.template.ast.Statement;
import org.stencil.template.ast.StringLiteral;
import org.stencil.template.ast.StripFlags;
import org.stencil.template.ast.SubExpression;
import org.stencil.template.lexer.Lexer;
import org.stencil.template.lexer.Token;
import org.stencil.template.lexer.TokenKind;

/**
 * Recursive descent parser from template source to a {@link Program}, with at most two tokens of
 * lookahead. The first error aborts parsing with a {@link ParseException}.
 *
 * <pre>
 * program     : statement*
 * statement   : mustache | block | rawBlock | partial | CONTENT | COMMENT
 * mustache    : OPEN expr param* hash? CLOSE | OPEN_UNESCAPED expr param* hash? CLOSE_UNESCAPED
 * block       : openBlock program inverseChain? closeBlock
 *             | openInverse program inverseAndProgram? closeBlock
 * rawBlock    : OPEN_RAW_BLOCK helperName param* hash? CLOSE_RAW_BLOCK CONTENT?
 *               OPEN_END_RAW_BLOCK helperName CLOSE_RAW_BLOCK
 * partial     : OPEN_PARTIAL (helperName | sexpr) param? hash? CLOSE
 * param       : helperName | sexpr
 * sexpr       : OPEN_SEXPR path param* hash? CLOSE_SEXPR
 * hash        : (ID EQUALS param)+
 * helperName  : path | DATA path | STRING | NUMBER | BOOLEAN
 * path        : ID (SEP ID)*
 * </pre>
 */
public class Parser {

  private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

  private static final Pattern OPEN_COMMENT = Pattern.compile("^\\{\\{~?!-?-?");
  private static final Pattern CLOSE_COMMENT = Pattern.compile("-?-?~?\\}\\}$");

  /** Tokens which end a program rather than start a statement. */
  private static final Set<TokenKind> PROGRAM_TERMINATORS = new HashSet<TokenKind>(Arrays.asList(
      TokenKind.EOF,
      TokenKind.OPEN_END_BLOCK,
      TokenKind.INVERSE,
      TokenKind.OPEN_INVERSE_CHAIN,
      TokenKind.OPEN_END_RAW_BLOCK));

  /** The opening tag of a block, or of an else in a chain. */
  private static class OpenBlock {
    final Token open;
    final PathExpression path;
    final List<Expression> params;
    final Hash hash;
    final List<String> blockParams;
    final StripFlags strip;

    OpenBlock(Token open, PathExpression path, List<Expression> params, Hash hash,
        List<String> blockParams, StripFlags strip) {
      this.open = open;
      this.path = path;
      this.params = params;
      this.hash = hash;
      this.blockParams = blockParams;
      this.strip = strip;
    }
  }

  /** {{else}} ... or {{else foo}} ... which follows a block's program. */
  private static class Inverse {
    final StripFlags strip;
    final Program program;

    Inverse(StripFlags strip, Program program) {
      this.strip = strip;
      this.program = program;
    }
  }

  /** A call: helperName param* hash?. */
  private static class Call {
    final Expression path;
    final List<Expression> params;
    final Hash hash;

    Call(Expression path, List<Expression> params, Hash hash) {
      this.path = path;
      this.params = params;
      this.hash = hash;
    }
  }

  private final Lexer lexer;
  private final List<Token> lookahead = new ArrayList<Token>(2);

  public Parser(String source) {
    this.lexer = new Lexer(source);
  }

  /**
   * Parses a template and applies whitespace control to it.
   */
  public static Program parse(String source) throws ParseException {
    return parse(source, false);
  }

  /**
   * Parses a template and applies whitespace control to it, optionally leaving standalone tags
   * untouched.
   */
  public static Program parse(String source, boolean ignoreStandalone) throws ParseException {
    Program program = new Parser(source).parseTemplate();
    new WhitespaceControl(ignoreStandalone).process(program);
    LOG.debug("Parsed template of {} characters into {} statements",
        source.length(), program.body.size());
    return program;
  }

  /**
   * Parses the whole source, without whitespace control.
   */
  public Program parseTemplate() throws ParseException {
    Program program = parseProgram(null);
    Token token = peek(0);
    if (token.kind != TokenKind.EOF)
      throw new ParseException("Unexpected " + describe(token), token.position());
    return program;
  }

  //
  // Statements.
  //

  private Program parseProgram(List<String> blockParams) {
    Position position = peek(0).position();
    List<Statement> body = new ArrayList<Statement>();
    while (!PROGRAM_TERMINATORS.contains(peek(0).kind))
      body.add(parseStatement());
    return new Program(position, body, blockParams, false);
  }

  private Statement parseStatement() {
    Token token = peek(0);
    switch (token.kind) {
      case CONTENT:
        advance();
        return new ContentStatement(token.position(), token.val);
      case COMMENT:
        advance();
        return parseComment(token);
      case OPEN:
      case OPEN_UNESCAPED:
        return parseMustache();
      case OPEN_BLOCK:
      case OPEN_INVERSE:
        return parseBlock();
      case OPEN_RAW_BLOCK:
        return parseRawBlock();
      case OPEN_PARTIAL:
        return parsePartial();
      default:
        throw new ParseException("Unexpected " + describe(token), token.position());
    }
  }

  private CommentStatement parseComment(Token token) {
    String value = OPEN_COMMENT.matcher(token.val).replaceFirst("");
    value = CLOSE_COMMENT.matcher(value).replaceFirst("");
    return new CommentStatement(token.position(), value, stripFlags(token, token));
  }

  private MustacheStatement parseMustache() {
    Token open = advance();
    Call call = parseCall(true);
    Token close = advanceOver(
        open.kind == TokenKind.OPEN_UNESCAPED ? TokenKind.CLOSE_UNESCAPED : TokenKind.CLOSE);
    boolean escaped = open.kind != TokenKind.OPEN_UNESCAPED && !open.val.endsWith("&");
    return new MustacheStatement(open.position(), call.path, call.params, call.hash, escaped,
        stripFlags(open, close));
  }

  private PartialStatement parsePartial() {
    Token open = advance();
    Expression name = (peek(0).kind == TokenKind.OPEN_SEXPR)
        ? parseSubExpression()
        : parseHelperName();
    List<Expression> params = parseParams();
    Hash hash = parseHash();
    Token close = advanceOver(TokenKind.CLOSE);
    if (params.size() > 1) {
      throw new ParseException(
          "Unsupported number of partial arguments: " + params.size(), open.position());
    }
    return new PartialStatement(open.position(), name, params, hash, stripFlags(open, close));
  }

  private BlockStatement parseBlock() {
    OpenBlock open = parseOpenBlock();
    boolean inverted = open.open.kind == TokenKind.OPEN_INVERSE;
    Program program = parseProgram(open.blockParams);

    Inverse inverse = null;
    Token next = peek(0);
    if (next.kind == TokenKind.INVERSE) {
      inverse = parseInverseAndProgram();
    } else if (next.kind == TokenKind.OPEN_INVERSE_CHAIN && !inverted) {
      inverse = parseInverseChain();
    }

    Token closeOpen = advanceOver(TokenKind.OPEN_END_BLOCK);
    PathExpression closePath = parsePath(peek(0).kind == TokenKind.DATA);
    Token close = advanceOver(TokenKind.CLOSE);
    if (!open.path.original.equals(closePath.original)) {
      throw new ParseException(
          "Start section " + open.path.original + " doesn't match end section " +
          closePath.original, closeOpen.position());
    }
    StripFlags closeStrip = stripFlags(closeOpen, close);

    if (inverse != null && inverse.program.chained) {
      // Blocks in an else chain are closed by the next else, the last one by this close.
      Program chain = inverse.program;
      boolean first = true;
      while (chain != null && chain.chained) {
        BlockStatement chained = (BlockStatement) chain.body.get(0);
        if (first || chained.closeStrip == null)
          chained.closeStrip = closeStrip;
        first = false;
        chain = chained.inverse;
      }
    }

    Program body = program;
    Program inverseBody = (inverse == null) ? null : inverse.program;
    if (inverted) {
      body = inverseBody;
      inverseBody = program;
    }
    return new BlockStatement(open.open.position(), open.path, open.params, open.hash, body,
        inverseBody, open.strip, (inverse == null) ? null : inverse.strip, closeStrip);
  }

  private OpenBlock parseOpenBlock() {
    Token open = advance();
    Call call = parseCall(false);
    if (!(call.path instanceof PathExpression)) {
      throw new ParseException("Expecting a path as block name", call.path.position);
    }
    List<String> blockParams = parseBlockParams();
    Token close = advanceOver(TokenKind.CLOSE);
    return new OpenBlock(open, (PathExpression) call.path, call.params, call.hash, blockParams,
        stripFlags(open, close));
  }

  private Inverse parseInverseAndProgram() {
    Token token = advanceOver(TokenKind.INVERSE);
    return new Inverse(stripFlags(token, token), parseProgram(null));
  }

  private Inverse parseInverseChain() {
    OpenBlock open = parseOpenBlock();
    Program program = parseProgram(open.blockParams);

    Inverse next = null;
    if (peek(0).kind == TokenKind.INVERSE) {
      next = parseInverseAndProgram();
    } else if (peek(0).kind == TokenKind.OPEN_INVERSE_CHAIN) {
      next = parseInverseChain();
    }

    StripFlags nextStrip = (next == null) ? null : next.strip;
    BlockStatement block = new BlockStatement(open.open.position(), open.path, open.params,
        open.hash, program, (next == null) ? null : next.program, open.strip, nextStrip,
        nextStrip);
    List<Statement> body = new ArrayList<Statement>();
    body.add(block);
    return new Inverse(open.strip, new Program(open.open.position(), body, null, true));
  }

  private BlockStatement parseRawBlock() {
    Token open = advance();
    Call call = parseCall(false);
    if (!(call.path instanceof PathExpression)) {
      throw new ParseException("Expecting a path as raw block name", call.path.position);
    }
    PathExpression path = (PathExpression) call.path;
    advanceOver(TokenKind.CLOSE_RAW_BLOCK);

    List<Statement> body = new ArrayList<Statement>();
    Position bodyPosition = peek(0).position();
    while (peek(0).kind == TokenKind.CONTENT) {
      Token content = advance();
      body.add(new ContentStatement(content.position(), content.val));
    }

    Token closeOpen = advanceOver(TokenKind.OPEN_END_RAW_BLOCK);
    PathExpression closePath = parsePath(false);
    advanceOver(TokenKind.CLOSE_RAW_BLOCK);
    if (!path.original.equals(closePath.original)) {
      throw new ParseException(
          "Start section " + path.original + " doesn't match end section " + closePath.original,
          closeOpen.position());
    }

    return new BlockStatement(open.position(), path, call.params, call.hash,
        new Program(bodyPosition, body), null, StripFlags.NONE, null, StripFlags.NONE);
  }

  //
  // Expressions.
  //

  /**
   * helperName param* hash?, where a mustache may also start with a sub-expression.
   */
  private Call parseCall(boolean allowSubExpression) {
    Expression path = (allowSubExpression && peek(0).kind == TokenKind.OPEN_SEXPR)
        ? parseSubExpression()
        : parseHelperName();
    List<Expression> params = parseParams();
    Hash hash = parseHash();
    return new Call(path, params, hash);
  }

  private SubExpression parseSubExpression() {
    Token open = advanceOver(TokenKind.OPEN_SEXPR);
    Expression path = parseHelperName();
    if (!(path instanceof PathExpression))
      throw new ParseException("Expecting a helper name in sub-expression", path.position);
    List<Expression> params = parseParams();
    Hash hash = parseHash();
    advanceOver(TokenKind.CLOSE_SEXPR);
    return new SubExpression(open.position(), (PathExpression) path, params, hash);
  }

  private List<Expression> parseParams() {
    List<Expression> params = new ArrayList<Expression>();
    while (isParamStart())
      params.add(parseParam());
    return params;
  }

  private boolean isParamStart() {
    Token token = peek(0);
    switch (token.kind) {
      case ID:
        return peek(1).kind != TokenKind.EQUALS;
      case OPEN_SEXPR:
      case DATA:
      case STRING:
      case NUMBER:
      case BOOLEAN:
        return true;
      default:
        return false;
    }
  }

  private Expression parseParam() {
    if (peek(0).kind == TokenKind.OPEN_SEXPR)
      return parseSubExpression();
    return parseHelperName();
  }

  private Hash parseHash() {
    if (peek(0).kind != TokenKind.ID || peek(1).kind != TokenKind.EQUALS)
      return null;

    Position position = peek(0).position();
    List<Hash.HashPair> pairs = new ArrayList<Hash.HashPair>();
    Set<String> keys = new HashSet<String>();
    while (peek(0).kind == TokenKind.ID && peek(1).kind == TokenKind.EQUALS) {
      Token key = advance();
      advance();
      if (!keys.add(key.val))
        throw new ParseException("Duplicate hash key: " + key.val, key.position());
      pairs.add(new Hash.HashPair(key.position(), key.val, parseParam()));
    }
    return new Hash(position, pairs);
  }

  private List<String> parseBlockParams() {
    if (peek(0).kind != TokenKind.OPEN_BLOCK_PARAMS)
      return null;
    Token open = advance();
    List<String> names = new ArrayList<String>();
    while (peek(0).kind == TokenKind.ID)
      names.add(stripBrackets(advance().val));
    advanceOver(TokenKind.CLOSE_BLOCK_PARAMS);
    if (names.isEmpty())
      throw new ParseException("Expecting at least one block parameter", open.position());
    return names;
  }

  private Expression parseHelperName() {
    Token token = peek(0);
    switch (token.kind) {
      case ID:
        return parsePath(false);
      case DATA:
        return parsePath(true);
      case STRING:
        advance();
        return new StringLiteral(token.position(), token.val);
      case NUMBER:
        advance();
        return new NumberLiteral(token.position(), parseNumber(token), token.val);
      case BOOLEAN:
        advance();
        return new BooleanLiteral(token.position(), Boolean.parseBoolean(token.val));
      default:
        throw new ParseException("Expecting an expression, got " + describe(token),
            token.position());
    }
  }

  /**
   * path : DATA? ID (SEP ID)*
   */
  private PathExpression parsePath(boolean data) {
    Position position = peek(0).position();
    if (data)
      advanceOver(TokenKind.DATA);

    StringBuilder original = new StringBuilder(data ? "@" : "");
    List<String> parts = new ArrayList<String>();
    int depth = 0;
    boolean scoped = false;

    Token segment = advanceOver(TokenKind.ID);
    while (true) {
      String part = stripBrackets(segment.val);
      boolean literal = !part.equals(segment.val);
      original.append(part);

      if (!literal && (part.equals("..") || part.equals(".") || part.equals("this"))) {
        if (!parts.isEmpty())
          throw new ParseException("Invalid path: " + original, segment.position());
        scoped = true;
        if (part.equals(".."))
          depth++;
      } else {
        parts.add(part);
      }

      if (peek(0).kind != TokenKind.SEP)
        break;
      original.append(advance().val);
      segment = advanceOver(TokenKind.ID);
    }

    return new PathExpression(position, data, depth, parts, original.toString(), scoped);
  }

  private static Number parseNumber(Token token) {
    String text = token.val;
    try {
      String unsigned = text.startsWith("-") || text.startsWith("+") ? text.substring(1) : text;
      boolean negative = text.startsWith("-");
      if (unsigned.startsWith("0x") || unsigned.startsWith("0X")) {
        long value = Long.parseLong(unsigned.substring(2), 16);
        return narrow(negative ? -value : value);
      }
      if (unsigned.indexOf('.') >= 0 || unsigned.indexOf('e') >= 0 || unsigned.indexOf('E') >= 0)
        return Double.valueOf(text);
      return narrow(Long.parseLong(text));
    } catch (NumberFormatException e) {
      throw new ParseException("Invalid number: " + text, token.position());
    }
  }

  private static Number narrow(long value) {
    if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
      return Integer.valueOf((int) value);
    return Long.valueOf(value);
  }

  private static String stripBrackets(String id) {
    if (id.length() >= 2 && id.startsWith("[") && id.endsWith("]"))
      return id.substring(1, id.length() - 1);
    return id;
  }

  private static StripFlags stripFlags(Token open, Token close) {
    return new StripFlags(open.hasLeftStrip(), close.hasRightStrip());
  }

  //
  // Token stream.
  //

  private Token peek(int i) {
    while (lookahead.size() <= i) {
      Token token = lexer.nextToken();
      if (token.kind == TokenKind.ERROR)
        throw new LexException(token.val, token.position());
      lookahead.add(token);
    }
    return lookahead.get(i);
  }

  private Token advance() {
    Token token = peek(0);
    lookahead.remove(0);
    return token;
  }

  private Token advanceOver(TokenKind kind) {
    Token token = peek(0);
    if (token.kind != kind) {
      throw new ParseException(
          "Expecting " + kind + ", got " + describe(token), token.position());
    }
    return advance();
  }

  private static String describe(Token token) {
    return token.toString();
  }

}
