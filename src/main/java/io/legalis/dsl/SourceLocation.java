package io.legalis.dsl;

/**
 * A position in DSL source text.
 *
 * @param line the 1-based line number
 * @param column the 1-based column number
 * @param offset the 0-based character offset from the start of the source
 */
public record SourceLocation(int line, int column, int offset) {

  /**
   * Computes the location of an offset by counting the newlines that precede it.
   *
   * <p>Offsets past the end of the source are clamped to the source length.
   *
   * @param offset the 0-based character offset
   * @param source the source text
   * @return the location of the offset
   */
  public static SourceLocation fromOffset(int offset, String source) {
    int clamped = Math.max(0, Math.min(offset, source.length()));
    int line = 1;
    int lastNewline = -1;
    for (int i = 0; i < clamped; i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lastNewline = i;
      }
    }
    return new SourceLocation(line, clamped - lastNewline, clamped);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
