package io.legalis.dsl.lexer;

import io.legalis.dsl.DslException;
import io.legalis.dsl.SourceLocation;

/**
 * Blanks out {@code // line} and {@code /* block *&#47;} comments.
 *
 * <p>Comment characters are replaced with spaces and line breaks are kept, so every offset, line
 * and column of the result matches the input. Block comments do not nest. Comment
 * markers inside string literals are left alone.
 */
public final class CommentStripper {
  private CommentStripper() {}

  /**
   * Returns the source with all comments replaced by whitespace.
   *
   * @param source the DSL source
   * @return a string of the same length without comments
   * @throws DslException if a block comment is never closed
   */
  public static String strip(String source) throws DslException {
    char[] out = source.toCharArray();
    int pos = 0;
    boolean inString = false;

    while (pos < out.length) {
      char ch = out[pos];

      if (inString) {
        if (ch == '\\' && pos + 1 < out.length) {
          pos += 2;
          continue;
        }
        if (ch == '"') {
          inString = false;
        }
        pos++;
        continue;
      }

      if (ch == '"') {
        inString = true;
        pos++;
        continue;
      }

      if (ch == '/' && pos + 1 < out.length && out[pos + 1] == '/') {
        while (pos < out.length && out[pos] != '\n') {
          out[pos++] = ' ';
        }
        continue;
      }

      if (ch == '/' && pos + 1 < out.length && out[pos + 1] == '*') {
        int close = source.indexOf("*/", pos + 2);
        if (close < 0) {
          throw DslException.unclosedComment(SourceLocation.fromOffset(pos, source));
        }
        int end = close + 2;
        for (int i = pos; i < end; i++) {
          if (out[i] != '\n' && out[i] != '\r') {
            out[i] = ' ';
          }
        }
        pos = end;
        continue;
      }

      pos++;
    }

    return new String(out);
  }
}
