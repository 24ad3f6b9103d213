package io.legalis.dsl;

/** The category of a fatal DSL error. */
public enum ErrorKind {
  /** A block comment was opened but never closed. */
  UNCLOSED_COMMENT("unclosed-comment"),
  /** Unexpected or malformed token sequence. */
  SYNTAX("syntax"),
  /** A reference to a statute that cannot be resolved. */
  UNDEFINED_REFERENCE("undefined-reference"),
  /** A condition that is well-formed but semantically invalid, such as a bad regex. */
  INVALID_CONDITION("invalid-condition"),
  /** A failure reported by the JSON or YAML serializer. */
  SERIALIZATION("serialization");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
