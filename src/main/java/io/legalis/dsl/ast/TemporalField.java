package io.legalis.dsl.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** The left-hand side of a {@link TemporalComparison}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TemporalField.CurrentDate.class, name = "CurrentDate"),
  @JsonSubTypes.Type(value = TemporalField.DateField.class, name = "DateField")
})
public sealed interface TemporalField permits TemporalField.CurrentDate, TemporalField.DateField {

  /** The evaluation date, written {@code CURRENT_DATE}, {@code NOW} or {@code TODAY}. */
  record CurrentDate() implements TemporalField {}

  /**
   * A named date attribute of the subject, written {@code DATE_FIELD name}.
   *
   * @param name the field name
   */
  record DateField(String name) implements TemporalField {}
}
