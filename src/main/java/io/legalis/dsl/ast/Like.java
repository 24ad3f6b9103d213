package io.legalis.dsl.ast;

/**
 * Wildcard pattern test; {@code %} matches any run of characters and {@code _} one.
 *
 * @param field the lower-cased field name
 * @param pattern the wildcard pattern
 */
public record Like(String field, String pattern) implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitLike(this);
  }
}
