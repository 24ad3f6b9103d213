package io.legalis.dsl.ast;

/**
 * Disjunction of two conditions.
 *
 * @param left the left operand
 * @param right the right operand
 */
public record Or(ConditionNode left, ConditionNode right) implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitOr(this);
  }
}
