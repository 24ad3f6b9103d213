package io.legalis.dsl;

/**
 * A non-fatal diagnostic recorded while parsing. Warnings never change the parse result.
 *
 * <ul>
 *   <li>{@link DeprecatedSyntax} - a legacy keyword was used in place of its modern form
 *   <li>{@link DuplicateClause} - a single-valued clause appeared more than once
 * </ul>
 */
public sealed interface DslWarning permits DslWarning.DeprecatedSyntax, DslWarning.DuplicateClause {

  /**
   * Returns where the warning was raised.
   *
   * @return the source location
   */
  SourceLocation location();

  /**
   * Returns the human-readable warning text.
   *
   * @return the message
   */
  String message();

  /**
   * A legacy keyword that is still accepted.
   *
   * @param location the location of the legacy keyword
   * @param oldSyntax the keyword as written
   * @param newSyntax the keyword that replaces it
   * @param message the warning text
   */
  record DeprecatedSyntax(
      SourceLocation location, String oldSyntax, String newSyntax, String message)
      implements DslWarning {

    /**
     * Creates a deprecation warning with the standard message.
     *
     * @param location the location of the legacy keyword
     * @param oldSyntax the keyword as written
     * @param newSyntax the keyword that replaces it
     * @return a new warning
     */
    public static DeprecatedSyntax of(SourceLocation location, String oldSyntax, String newSyntax) {
      return new DeprecatedSyntax(
          location,
          oldSyntax,
          newSyntax,
          "'" + oldSyntax + "' is deprecated, use '" + newSyntax + "' instead");
    }
  }

  /**
   * A clause that may appear once per statute but was repeated; the last occurrence wins.
   *
   * @param location the location of the repeated clause
   * @param clause the clause keyword
   * @param message the warning text
   */
  record DuplicateClause(SourceLocation location, String clause, String message)
      implements DslWarning {}
}
