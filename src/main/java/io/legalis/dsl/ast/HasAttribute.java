package io.legalis.dsl.ast;

/**
 * True when the subject carries the named attribute.
 *
 * @param key the attribute name as written
 */
public record HasAttribute(String key) implements ConditionNode {
  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitHasAttribute(this);
  }
}
