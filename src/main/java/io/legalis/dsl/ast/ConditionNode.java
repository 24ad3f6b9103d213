package io.legalis.dsl.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Sealed interface for boolean eligibility conditions.
 *
 * <p>There are 12 kinds of condition:
 *
 * <ul>
 *   <li>{@link And}, {@link Or}, {@link Not} - boolean connectives
 *   <li>{@link HasAttribute} - "HAS disabled"
 *   <li>{@link Comparison} - "AGE &gt;= 18"
 *   <li>{@link Between} - "income BETWEEN 0 AND 50000"
 *   <li>{@link In} - "status IN ("single", "widowed")"
 *   <li>{@link Like} - "name LIKE "Dr.%""
 *   <li>{@link Matches} - "code MATCHES "^[A-Z]{3}$""
 *   <li>{@link TemporalComparison} - "CURRENT_DATE &gt;= 2024-01-01"
 *   <li>{@link InRange}, {@link NotInRange} - "age IN_RANGE 18..65"
 * </ul>
 *
 * <p>Nodes are immutable and own their children; trees never share nodes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = And.class, name = "And"),
  @JsonSubTypes.Type(value = Or.class, name = "Or"),
  @JsonSubTypes.Type(value = Not.class, name = "Not"),
  @JsonSubTypes.Type(value = HasAttribute.class, name = "HasAttribute"),
  @JsonSubTypes.Type(value = Comparison.class, name = "Comparison"),
  @JsonSubTypes.Type(value = Between.class, name = "Between"),
  @JsonSubTypes.Type(value = In.class, name = "In"),
  @JsonSubTypes.Type(value = Like.class, name = "Like"),
  @JsonSubTypes.Type(value = Matches.class, name = "Matches"),
  @JsonSubTypes.Type(value = TemporalComparison.class, name = "TemporalComparison"),
  @JsonSubTypes.Type(value = InRange.class, name = "InRange"),
  @JsonSubTypes.Type(value = NotInRange.class, name = "NotInRange")
})
public sealed interface ConditionNode
    permits And,
        Or,
        Not,
        HasAttribute,
        Comparison,
        Between,
        In,
        Like,
        Matches,
        TemporalComparison,
        InRange,
        NotInRange {

  /**
   * Dispatches to the visitor method for this node's kind.
   *
   * @param visitor the visitor
   * @param <R> the result type
   * @param <X> the exception type the visitor may throw
   * @return the visitor's result
   * @throws X if the visitor throws
   */
  <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

  /**
   * Exhaustive dispatch over every condition kind.
   *
   * @param <R> the result type
   * @param <X> the exception type visit methods may throw
   */
  interface Visitor<R, X extends Exception> {
    R visitAnd(And node) throws X;

    R visitOr(Or node) throws X;

    R visitNot(Not node) throws X;

    R visitHasAttribute(HasAttribute node) throws X;

    R visitComparison(Comparison node) throws X;

    R visitBetween(Between node) throws X;

    R visitIn(In node) throws X;

    R visitLike(Like node) throws X;

    R visitMatches(Matches node) throws X;

    R visitTemporalComparison(TemporalComparison node) throws X;

    R visitInRange(InRange node) throws X;

    R visitNotInRange(NotInRange node) throws X;
  }
}
