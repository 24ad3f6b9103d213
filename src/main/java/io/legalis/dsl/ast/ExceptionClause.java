package io.legalis.dsl.ast;

import java.util.List;

/**
 * An exception carved out of a statute.
 *
 * @param conditions the conditions under which the exception applies (empty if unconditional)
 * @param description the exception text
 */
public record ExceptionClause(List<ConditionNode> conditions, String description) {
  /** Creates a new ExceptionClause with a defensive copy of the conditions. */
  public ExceptionClause {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }
}
