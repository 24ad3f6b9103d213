package io.legalis.dsl.ast;

/**
 * A default value for an input field.
 *
 * @param field the field name
 * @param value the default
 */
public record DefaultClause(String field, ConditionValue value) {}
