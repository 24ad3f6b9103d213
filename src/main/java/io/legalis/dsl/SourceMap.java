package io.legalis.dsl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Maps offsets of one source text to line/column locations using a precomputed line index. */
public final class SourceMap {
  private final String source;
  private final int[] lineStarts;

  /**
   * Indexes the line starts of a source text.
   *
   * @param source the source text
   */
  public SourceMap(String source) {
    this.source = source;
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Returns the location of an offset. Agrees with {@link SourceLocation#fromOffset}.
   *
   * @param offset the 0-based offset
   * @return the location
   */
  public SourceLocation locate(int offset) {
    int clamped = Math.max(0, Math.min(offset, source.length()));
    int idx = Arrays.binarySearch(lineStarts, clamped);
    int line = idx >= 0 ? idx : -idx - 2;
    return new SourceLocation(line + 1, clamped - lineStarts[line] + 1, clamped);
  }

  /**
   * Returns the span between two offsets.
   *
   * @param start the start offset (inclusive)
   * @param end the end offset (exclusive)
   * @return the span
   */
  public SourceSpan span(int start, int end) {
    return new SourceSpan(locate(start), locate(end));
  }

  /**
   * Returns the text of a 1-based line without its line terminator.
   *
   * @param line the 1-based line number
   * @return the line text, or an empty string if the line does not exist
   */
  public String lineText(int line) {
    if (line < 1 || line > lineStarts.length) {
      return "";
    }
    int from = lineStarts[line - 1];
    int to = line < lineStarts.length ? lineStarts[line] - 1 : source.length();
    if (to > from && source.charAt(to - 1) == '\r') {
      to--;
    }
    return source.substring(from, Math.max(from, to));
  }
}
