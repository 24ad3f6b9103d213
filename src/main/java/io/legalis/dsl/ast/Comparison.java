package io.legalis.dsl.ast;

/**
 * Compares a field against a value, e.g. {@code age >= 18}.
 *
 * @param field the lower-cased field name
 * @param operator one of {@code == != > >= < <=}
 * @param value the right-hand side
 */
public record Comparison(
    String field,
    String operator,
    ConditionValue value)
    implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitComparison(this);
  }
}
