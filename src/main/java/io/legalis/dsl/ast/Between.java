package io.legalis.dsl.ast;

/**
 * Inclusive range test, e.g. {@code income BETWEEN 0 AND 50000}.
 *
 * @param field the lower-cased field name
 * @param min the lower bound (inclusive)
 * @param max the upper bound (inclusive)
 */
public record Between(
    String field,
    ConditionValue min,
    ConditionValue max)
    implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitBetween(this);
  }
}
