package io.legalis.dsl.ast;

import java.util.List;

/**
 * Membership test against a list of values.
 *
 * @param field the lower-cased field name
 * @param values the candidate values
 */
public record In(String field, List<ConditionValue> values) implements ConditionNode {
  /** Creates a new In node with a defensive copy of the values. */
  public In {
    values = List.copyOf(values);
  }

  @Override
  public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
    return visitor.visitIn(this);
  }
}
