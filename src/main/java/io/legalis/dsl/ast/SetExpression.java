package io.legalis.dsl.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * Set algebra over condition values.
 *
 * <p>The grammar has no set operators; sets are built programmatically and embedded with {@link
 * ConditionValue.SetExpr}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = SetExpression.Values.class, name = "Values"),
  @JsonSubTypes.Type(value = SetExpression.Union.class, name = "Union"),
  @JsonSubTypes.Type(value = SetExpression.Intersect.class, name = "Intersect"),
  @JsonSubTypes.Type(value = SetExpression.Difference.class, name = "Difference")
})
public sealed interface SetExpression
    permits SetExpression.Values,
        SetExpression.Union,
        SetExpression.Intersect,
        SetExpression.Difference {

  /**
   * An explicit list of members.
   *
   * @param values the members
   */
  record Values(List<ConditionValue> values) implements SetExpression {
    /** Creates a new Values set with a defensive copy. */
    public Values {
      values = List.copyOf(values);
    }
  }

  /**
   * Members of either operand.
   *
   * @param left the left operand
   * @param right the right operand
   */
  record Union(SetExpression left, SetExpression right) implements SetExpression {}

  /**
   * Members of both operands.
   *
   * @param left the left operand
   * @param right the right operand
   */
  record Intersect(SetExpression left, SetExpression right) implements SetExpression {}

  /**
   * Members of the left operand that are not in the right.
   *
   * @param left the left operand
   * @param right the right operand
   */
  record Difference(SetExpression left, SetExpression right) implements SetExpression {}
}
