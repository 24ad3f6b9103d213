package io.legalis.dsl.display;

/**
 * Formatting options for {@link DslPrinter}.
 *
 * @param indent the indentation of clauses inside a statute body
 * @param includeComments whether to precede each statute with a comment naming it
 */
public record PrinterConfig(String indent, boolean includeComments) {
  /**
   * Returns the default configuration: four-space indent, no comments.
   *
   * @return the default configuration
   */
  public static PrinterConfig defaults() {
    return new PrinterConfig("    ", false);
  }

  /**
   * Returns a compact configuration with a two-space indent.
   *
   * @return the compact configuration
   */
  public static PrinterConfig compact() {
    return new PrinterConfig("  ", false);
  }

  /**
   * Returns a verbose configuration with header comments.
   *
   * @return the verbose configuration
   */
  public static PrinterConfig verbose() {
    return new PrinterConfig("    ", true);
  }
}
