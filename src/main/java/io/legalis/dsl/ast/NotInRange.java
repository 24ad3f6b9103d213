package io.legalis.dsl.ast;

/**
 * Negated range test; true when the field lies outside the range.
 *
 * @param field the lower-cased field name
 * @param min the lower bound
 * @param max the upper bound
 * @param inclusiveMin whether {@code min} itself belongs to the excluded range
 * @param inclusiveMax whether {@code max} itself belongs to the excluded range
 */
public record NotInRange(
    String field,
    ConditionValue min,
    ConditionValue max,
    boolean inclusiveMin,
    boolean inclusiveMax)
    implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitNotInRange(this);
  }
}
