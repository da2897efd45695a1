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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.stencil.template.ast.BlockStatement;
import org.stencil.template.ast.BooleanLiteral;
import org.stencil.template.ast.CommentStatement;
import org.stencil.template.ast.ContentStatement;
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
import org.stencil.template.ast.Visitor;

/**
 * Rewrites the content around tags, in place, for ~ strip markers and standalone tags.
 *
 * A ~ inside a tag's delimiter removes all whitespace on that side of the tag. A block, inverse,
 * partial or comment tag which is alone on its line loses the whitespace of that line including
 * the newline; a standalone partial remembers the indentation it had. Mustaches are never
 * standalone.
 *
 * Each root program is processed once; processing it again changes nothing.
 */
public class WhitespaceControl implements Visitor<WhitespaceControl.Strip> {

  /** What a statement tells its program about the whitespace around it. */
  static class Strip {
    final boolean open;
    final boolean close;
    final boolean openStandalone;
    final boolean closeStandalone;
    final boolean inlineStandalone;

    Strip(boolean open, boolean close, boolean openStandalone, boolean closeStandalone,
        boolean inlineStandalone) {
      this.open = open;
      this.close = close;
      this.openStandalone = openStandalone;
      this.closeStandalone = closeStandalone;
      this.inlineStandalone = inlineStandalone;
    }
  }

  private static final Pattern PREV_WHITESPACE = Pattern.compile("\\r?\\n\\s*?\\z");
  private static final Pattern PREV_WHITESPACE_ROOT = Pattern.compile("(^|\\r?\\n)\\s*?\\z");
  private static final Pattern NEXT_WHITESPACE = Pattern.compile("^\\s*?\\r?\\n");
  private static final Pattern NEXT_WHITESPACE_ROOT = Pattern.compile("^\\s*?(\\r?\\n|\\z)");

  private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s+");
  private static final Pattern LEADING_LINE = Pattern.compile("^[ \\t]*\\r?\\n?");
  private static final Pattern TRAILING_WHITESPACE = Pattern.compile("\\s+\\z");
  private static final Pattern TRAILING_INDENT = Pattern.compile("[ \\t]+\\z");

  private final boolean ignoreStandalone;
  private boolean rootSeen = false;

  public WhitespaceControl() {
    this(false);
  }

  public WhitespaceControl(boolean ignoreStandalone) {
    this.ignoreStandalone = ignoreStandalone;
  }

  /** Processes {@code root} unless it already has been. */
  public Program process(Program root) {
    if (root.isWhitespaceProcessed())
      return root;
    rootSeen = false;
    root.accept(this);
    root.markWhitespaceProcessed();
    return root;
  }

  @Override
  public Strip visitProgram(Program program) {
    boolean isRoot = !rootSeen;
    rootSeen = true;
    List<Statement> body = program.body;

    for (int i = 0; i < body.size(); i++) {
      Statement current = body.get(i);
      Strip strip = current.accept(this);
      if (strip == null)
        continue;

      boolean prevWhitespace = isPrevWhitespace(body, i, isRoot);
      boolean nextWhitespace = isNextWhitespace(body, i, isRoot);
      boolean openStandalone = strip.openStandalone && prevWhitespace;
      boolean closeStandalone = strip.closeStandalone && nextWhitespace;
      boolean inlineStandalone = strip.inlineStandalone && prevWhitespace && nextWhitespace;

      if (strip.close)
        omitRight(body, i, true);
      if (strip.open)
        omitLeft(body, i, true);

      if (!ignoreStandalone && inlineStandalone) {
        omitRight(body, i, false);
        if (omitLeft(body, i, false) && current instanceof PartialStatement) {
          Matcher indent = TRAILING_INDENT.matcher(((ContentStatement) body.get(i - 1)).original);
          ((PartialStatement) current).indent = indent.find() ? indent.group() : "";
        }
      }
      if (!ignoreStandalone && openStandalone) {
        BlockStatement block = (BlockStatement) current;
        omitRight(firstNonNull(block.program, block.inverse).body, -1, false);
        omitLeft(body, i, false);
      }
      if (!ignoreStandalone && closeStandalone) {
        BlockStatement block = (BlockStatement) current;
        omitRight(body, i, false);
        List<Statement> last = firstNonNull(block.inverse, block.program).body;
        omitLeft(last, last.size(), false);
      }
    }
    return null;
  }

  @Override
  public Strip visitBlock(BlockStatement block) {
    if (block.program != null)
      block.program.accept(this);
    if (block.inverse != null)
      block.inverse.accept(this);

    Program program = firstNonNull(block.program, block.inverse);
    Program inverse = (block.program != null) ? block.inverse : null;
    Program firstInverse = inverse;
    Program lastInverse = inverse;
    if (inverse != null && inverse.chained) {
      firstInverse = ((BlockStatement) inverse.body.get(0)).program;
      while (lastInverse.chained) {
        BlockStatement chained =
            (BlockStatement) lastInverse.body.get(lastInverse.body.size() - 1);
        lastInverse = chained.program;
      }
    }

    StripFlags closeStrip = (block.closeStrip == null) ? StripFlags.NONE : block.closeStrip;
    Strip strip = new Strip(
        block.openStrip.open,
        closeStrip.close,
        isNextWhitespace(program.body, -1, false),
        isPrevWhitespace(firstNonNull(firstInverse, program).body, -1, false),
        false);

    if (block.openStrip.close)
      omitRight(program.body, -1, true);

    if (inverse != null) {
      StripFlags inverseStrip =
          (block.inverseStrip == null) ? StripFlags.NONE : block.inverseStrip;
      if (inverseStrip.open)
        omitLeft(program.body, program.body.size(), true);
      if (inverseStrip.close)
        omitRight(firstInverse.body, -1, true);
      if (closeStrip.open)
        omitLeft(lastInverse.body, lastInverse.body.size(), true);

      // A standalone {{else}}.
      if (!ignoreStandalone &&
          isPrevWhitespace(program.body, -1, false) &&
          isNextWhitespace(firstInverse.body, -1, false)) {
        omitLeft(program.body, program.body.size(), false);
        omitRight(firstInverse.body, -1, false);
      }
    } else if (closeStrip.open) {
      omitLeft(program.body, program.body.size(), true);
    }
    return strip;
  }

  @Override
  public Strip visitMustache(MustacheStatement mustache) {
    return new Strip(mustache.strip.open, mustache.strip.close, false, false, false);
  }

  @Override
  public Strip visitPartial(PartialStatement partial) {
    return new Strip(partial.strip.open, partial.strip.close, false, false, true);
  }

  @Override
  public Strip visitComment(CommentStatement comment) {
    return new Strip(comment.strip.open, comment.strip.close, false, false, true);
  }

  @Override
  public Strip visitContent(ContentStatement content) {
    return null;
  }

  // Expressions hold no whitespace.

  @Override
  public Strip visitSubExpression(SubExpression node) {
    return null;
  }

  @Override
  public Strip visitPath(PathExpression node) {
    return null;
  }

  @Override
  public Strip visitString(StringLiteral node) {
    return null;
  }

  @Override
  public Strip visitBoolean(BooleanLiteral node) {
    return null;
  }

  @Override
  public Strip visitNumber(NumberLiteral node) {
    return null;
  }

  @Override
  public Strip visitHash(Hash node) {
    return null;
  }

  /**
   * Whether the statement before {@code i} ends its line with nothing but whitespace. An index of
   * -1 means after the last statement.
   */
  private static boolean isPrevWhitespace(List<Statement> body, int i, boolean isRoot) {
    if (i < 0)
      i = body.size();
    if (i - 1 < 0)
      return isRoot;
    Statement prev = body.get(i - 1);
    if (!(prev instanceof ContentStatement))
      return false;
    boolean sibling = i - 2 >= 0;
    Pattern pattern = (sibling || !isRoot) ? PREV_WHITESPACE : PREV_WHITESPACE_ROOT;
    return pattern.matcher(((ContentStatement) prev).original).find();
  }

  /**
   * Whether the statement after {@code i} starts with a line of nothing but whitespace. An index
   * of -1 means before the first statement.
   */
  private static boolean isNextWhitespace(List<Statement> body, int i, boolean isRoot) {
    if (i + 1 >= body.size())
      return isRoot;
    Statement next = body.get(i + 1);
    if (!(next instanceof ContentStatement))
      return false;
    boolean sibling = i + 2 < body.size();
    Pattern pattern = (sibling || !isRoot) ? NEXT_WHITESPACE : NEXT_WHITESPACE_ROOT;
    return pattern.matcher(((ContentStatement) next).original).find();
  }

  /**
   * Strips the content after {@code i}: all leading whitespace if {@code multiple}, otherwise the
   * rest of the line including its newline.
   */
  private static void omitRight(List<Statement> body, int i, boolean multiple) {
    if (i + 1 >= body.size())
      return;
    Statement statement = body.get(i + 1);
    if (!(statement instanceof ContentStatement))
      return;
    ContentStatement current = (ContentStatement) statement;
    if (!multiple && current.rightStripped)
      return;
    String original = current.value;
    current.value = (multiple ? LEADING_WHITESPACE : LEADING_LINE).matcher(original)
        .replaceFirst("");
    current.rightStripped = !current.value.equals(original);
  }

  /**
   * Strips the content before {@code i}: all trailing whitespace if {@code multiple}, otherwise
   * the indentation of the line. Returns whether anything was stripped.
   */
  private static boolean omitLeft(List<Statement> body, int i, boolean multiple) {
    if (i - 1 < 0 || i - 1 >= body.size())
      return false;
    Statement statement = body.get(i - 1);
    if (!(statement instanceof ContentStatement))
      return false;
    ContentStatement current = (ContentStatement) statement;
    if (!multiple && current.leftStripped)
      return false;
    String original = current.value;
    current.value = (multiple ? TRAILING_WHITESPACE : TRAILING_INDENT).matcher(original)
        .replaceFirst("");
    current.leftStripped = !current.value.equals(original);
    return current.leftStripped;
  }

  private static Program firstNonNull(Program first, Program second) {
    return (first != null) ? first : second;
  }

}
