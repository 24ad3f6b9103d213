package io.legalis.dsl.ast;

/**
 * Negation of a condition.
 *
 * @param inner the negated condition
 */
public record Not(ConditionNode inner) implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitNot(this);
  }
}
