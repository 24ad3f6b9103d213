package io.legalis.dsl.validate;

/**
 * A semantic problem found in a parsed document.
 *
 * @param kind the category of problem
 * @param statuteId the statute the problem was found in
 * @param message a human-readable description
 */
public record ValidationError(Kind kind, String statuteId, String message) {

  /** The category of a validation problem. */
  public enum Kind {
    /** Two statutes share an id. */
    DUPLICATE_STATUTE_ID,
    /** A statute requires or supersedes itself. */
    SELF_REFERENCE,
    /** A REQUIRES clause names a statute that is not in the document. */
    UNDEFINED_REFERENCE,
    /** An AMENDMENT clause targets a statute that is not in the document. */
    INVALID_AMENDMENT,
    /** The effective date is after the expiry date. */
    INVALID_DATE_RANGE,
    /** A BETWEEN or IN_RANGE condition can never hold. */
    INVALID_NUMERIC_RANGE,
    /** REQUIRES clauses form a cycle. */
    CIRCULAR_DEPENDENCY
  }

  @Override
  public String toString() {
    return kind + " in '" + statuteId + "': " + message;
  }
}
