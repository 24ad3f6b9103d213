package io.legalis.dsl.lower;

import java.time.LocalDate;
import java.util.List;

/** Precondition of a lowered {@link Statute}. */
public sealed interface Condition
    permits Condition.Age,
        Condition.Income,
        Condition.HasAttribute,
        Condition.AttributeEquals,
        Condition.SetMembership,
        Condition.DateRange,
        Condition.And,
        Condition.Or,
        Condition.Not,
        Condition.Custom {

  /**
   * Age in years compared against a value.
   *
   * @param operator the comparison
   * @param value the age
   */
  record Age(ComparisonOp operator, long value) implements Condition {}

  /**
   * Income compared against a value.
   *
   * @param operator the comparison
   * @param value the income
   */
  record Income(ComparisonOp operator, long value) implements Condition {}

  /**
   * Presence of an attribute.
   *
   * @param key the attribute name
   */
  record HasAttribute(String key) implements Condition {}

  /**
   * An attribute equal to a string value.
   *
   * @param key the attribute name
   * @param value the required value
   */
  record AttributeEquals(String key, String value) implements Condition {}

  /**
   * An attribute whose value is (or is not) one of a set.
   *
   * @param attribute the attribute name
   * @param values the set members
   * @param negated true for "not in"
   */
  record SetMembership(String attribute, List<String> values, boolean negated)
      implements Condition {
    /** Creates a new SetMembership with a defensive copy of the values. */
    public SetMembership {
      values = List.copyOf(values);
    }
  }

  /**
   * The evaluation date lies within an inclusive range.
   *
   * @param start the first day (null for unbounded)
   * @param end the last day (null for unbounded)
   */
  record DateRange(LocalDate start, LocalDate end) implements Condition {}

  /**
   * Both conditions hold.
   *
   * @param left the left operand
   * @param right the right operand
   */
  record And(Condition left, Condition right) implements Condition {}

  /**
   * Either condition holds.
   *
   * @param left the left operand
   * @param right the right operand
   */
  record Or(Condition left, Condition right) implements Condition {}

  /**
   * The condition does not hold.
   *
   * @param inner the negated condition
   */
  record Not(Condition inner) implements Condition {}

  /**
   * A condition the downstream model cannot express, kept as text for a human to evaluate.
   *
   * @param description the condition text
   */
  record Custom(String description) implements Condition {}
}
