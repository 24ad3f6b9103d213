package io.legalis.dsl.ast;

/**
 * Compares the current date or a date-valued field against a date.
 *
 * @param field what is compared
 * @param operator one of {@code == != > >= < <=}
 * @param value the date to compare against
 */
public record TemporalComparison(
    TemporalField field,
    String operator,
    ConditionValue value)
    implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitTemporalComparison(this);
  }
}
