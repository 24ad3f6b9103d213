package io.legalis.dsl;

/**
 * A range of source text between two locations.
 *
 * @param start the start location (inclusive)
 * @param end the end location (exclusive)
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {
  /** Validates that the span does not run backwards. */
  public SourceSpan {
    if (start.offset() > end.offset()) {
      throw new IllegalArgumentException(
          "span start " + start.offset() + " is after end " + end.offset());
    }
  }

  /**
   * Creates a zero-length span at a single location.
   *
   * @param location the location
   * @return a span starting and ending at the location
   */
  public static SourceSpan point(SourceLocation location) {
    return new SourceSpan(location, location);
  }

  /**
   * Returns the number of characters covered by this span.
   *
   * @return the distance between the end and start offsets
   */
  public int len() {
    return end.offset() - start.offset();
  }

  /**
   * Returns true when the span covers no characters.
   *
   * @return whether start and end offsets coincide
   */
  public boolean isEmpty() {
    return start.offset() == end.offset();
  }

  /**
   * Returns the slice of the source covered by this span.
   *
   * @param source the source text the span was taken from
   * @return the characters between the start and end offsets
   */
  public String text(String source) {
    int from = Math.min(start.offset(), source.length());
    int to = Math.min(end.offset(), source.length());
    return source.substring(from, to);
  }

  @Override
  public String toString() {
    if (start.line() == end.line()) {
      return start.line() + ":" + start.column() + "-" + end.column();
    }
    return start.line() + ":" + start.column() + " to " + end.line() + ":" + end.column();
  }
}
