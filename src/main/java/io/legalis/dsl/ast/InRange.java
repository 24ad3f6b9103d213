package io.legalis.dsl.ast;

/**
 * Range test with configurable bound inclusivity.
 *
 * @param field the lower-cased field name
 * @param min the lower bound
 * @param max the upper bound
 * @param inclusiveMin whether {@code min} itself is in range
 * @param inclusiveMax whether {@code max} itself is in range
 */
public record InRange(
    String field,
    ConditionValue min,
    ConditionValue max,
    boolean inclusiveMin,
    boolean inclusiveMax)
    implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitInRange(this);
  }
}
