package io.legalis.dsl.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A literal operand of a condition. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ConditionValue.Number.class, name = "Number"),
  @JsonSubTypes.Type(value = ConditionValue.Text.class, name = "String"),
  @JsonSubTypes.Type(value = ConditionValue.Date.class, name = "Date"),
  @JsonSubTypes.Type(value = ConditionValue.SetExpr.class, name = "SetExpr")
})
public sealed interface ConditionValue
    permits ConditionValue.Number,
        ConditionValue.Text,
        ConditionValue.Date,
        ConditionValue.SetExpr {

  /**
   * Creates a number value.
   *
   * @param value the number
   * @return a new number value
   */
  static ConditionValue number(long value) {
    return new Number(value);
  }

  /**
   * Creates a string value.
   *
   * @param value the string
   * @return a new string value
   */
  static ConditionValue text(String value) {
    return new Text(value);
  }

  /**
   * Creates a date value.
   *
   * @param value the ISO date text
   * @return a new date value
   */
  static ConditionValue date(String value) {
    return new Date(value);
  }

  /**
   * A signed 64-bit integer.
   *
   * @param value the number
   */
  record Number(long value) implements ConditionValue {}

  /**
   * A string literal or bare identifier used as a value.
   *
   * @param value the string
   */
  record Text(String value) implements ConditionValue {}

  /**
   * An ISO date, kept as written.
   *
   * @param value the date text (e.g., "2024-01-15")
   */
  record Date(String value) implements ConditionValue {}

  /**
   * A set built with {@link SetExpression} algebra.
   *
   * @param expression the set expression
   */
  record SetExpr(SetExpression expression) implements ConditionValue {}
}
