package io.legalis.dsl;

import java.util.Optional;

/** Exception thrown for fatal errors while lexing, parsing, lowering or serializing DSL sources. */
public final class DslException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** Where the error occurred, if known. */
  private final SourceLocation location;

  /** What the parser expected (syntax errors only). */
  private final String expected;

  /** The offending token (syntax errors only). */
  private final String found;

  /** The unresolved name (undefined references only). */
  private final String name;

  /** An optional suggestion for fixing the error. */
  private final String hint;

  private DslException(
      ErrorKind kind,
      String message,
      SourceLocation location,
      String expected,
      String found,
      String name,
      String hint,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.location = location;
    this.expected = expected;
    this.found = found;
    this.name = name;
    this.hint = hint;
  }

  /**
   * Creates an error for a block comment that is never closed.
   *
   * @param location the location of the opening {@code /*}, or null if unknown
   * @return a new DslException of kind {@link ErrorKind#UNCLOSED_COMMENT}
   */
  public static DslException unclosedComment(SourceLocation location) {
    String message =
        location == null
            ? "Unclosed block comment"
            : "Unclosed block comment starting at " + location;
    return new DslException(
        ErrorKind.UNCLOSED_COMMENT,
        message,
        location,
        null,
        null,
        null,
        "close the comment with '*/'",
        null);
  }

  /**
   * Creates a syntax error.
   *
   * @param location where the offending token starts
   * @param expected a description of the construct being parsed
   * @param found a description of the offending token
   * @param hint an optional suggestion, may be null
   * @return a new DslException of kind {@link ErrorKind#SYNTAX}
   */
  public static DslException syntax(
      SourceLocation location, String expected, String found, String hint) {
    String message = "Syntax error at " + location + ": expected " + expected + ", found " + found;
    return new DslException(
        ErrorKind.SYNTAX, message, location, expected, found, null, hint, null);
  }

  /**
   * Creates an error for a name that does not resolve.
   *
   * @param location where the reference appears
   * @param name the unresolved name
   * @param hint an optional suggestion, may be null
   * @return a new DslException of kind {@link ErrorKind#UNDEFINED_REFERENCE}
   */
  public static DslException undefinedReference(SourceLocation location, String name, String hint) {
    String message = "Undefined reference '" + name + "' at " + location;
    return new DslException(
        ErrorKind.UNDEFINED_REFERENCE, message, location, null, null, name, hint, null);
  }

  /**
   * Creates an invalid condition error without a known location.
   *
   * @param message the error message
   * @return a new DslException of kind {@link ErrorKind#INVALID_CONDITION}
   */
  public static DslException invalidCondition(String message) {
    return invalidCondition(message, null);
  }

  /**
   * Creates an invalid condition error.
   *
   * @param message the error message
   * @param location where the condition appears, may be null
   * @return a new DslException of kind {@link ErrorKind#INVALID_CONDITION}
   */
  public static DslException invalidCondition(String message, SourceLocation location) {
    return new DslException(
        ErrorKind.INVALID_CONDITION, message, location, null, null, null, null, null);
  }

  /**
   * Wraps a failure of the JSON or YAML serializer.
   *
   * @param message the error message
   * @param cause the serializer exception
   * @return a new DslException of kind {@link ErrorKind#SERIALIZATION}
   */
  public static DslException serialization(String message, Throwable cause) {
    return new DslException(
        ErrorKind.SERIALIZATION, message, null, null, null, null, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the location of the error, if available.
   *
   * @return the location, or empty if not available
   */
  public Optional<SourceLocation> location() {
    return Optional.ofNullable(location);
  }

  /**
   * Returns a point span at the error location, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<SourceSpan> span() {
    return location().map(SourceSpan::point);
  }

  /**
   * Returns what the parser expected, for syntax errors.
   *
   * @return the expected construct, or empty
   */
  public Optional<String> expected() {
    return Optional.ofNullable(expected);
  }

  /**
   * Returns the offending token, for syntax errors.
   *
   * @return the found token description, or empty
   */
  public Optional<String> found() {
    return Optional.ofNullable(found);
  }

  /**
   * Returns the unresolved name, for undefined references.
   *
   * @return the name, or empty
   */
  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the hint, or empty if not available
   */
  public Optional<String> hint() {
    return Optional.ofNullable(hint);
  }

  /**
   * Formats a rich error message with the offending line, an underline and the hint.
   *
   * <p>For errors with a location, produces output like:
   *
   * <pre>
   * error: Syntax error at 2:5: expected clause keyword, found 'WHN'
   *   2 |     WHN AGE &gt;= 18
   *     |     ^
   *   hint: did you mean 'WHEN'?
   * </pre>
   *
   * @param source the source text the error was reported against
   * @return a formatted error message
   */
  public String displayRich(String source) {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage());
    if (location != null && source != null) {
      String lineText = new SourceMap(source).lineText(location.line());
      String gutter = String.valueOf(location.line());
      sb.append("\n  ").append(gutter).append(" | ").append(lineText);
      sb.append("\n  ").append(" ".repeat(gutter.length())).append(" | ");
      sb.append(" ".repeat(Math.max(0, location.column() - 1))).append('^');
    }
    if (hint != null && !hint.isEmpty()) {
      sb.append("\n  hint: ").append(hint);
    }
    return sb.toString();
  }
}
