package io.legalis.dsl.ast;

/**
 * Conjunction of two conditions.
 *
 * @param left the left operand
 * @param right the right operand
 */
public record And(ConditionNode left, ConditionNode right) implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitAnd(this);
  }
}
