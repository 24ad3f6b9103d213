package io.legalis.dsl.lower;

import java.util.List;

/**
 * A statute reduced to preconditions and a single effect, as consumed by rule evaluation.
 *
 * @param id the statute identifier
 * @param title the statute title
 * @param preconditions conditions that must all hold
 * @param effect the legal effect
 * @param discretionLogic guidance for human decision-makers (may be null)
 * @param jurisdiction the jurisdiction (may be null)
 * @param version the statute version
 * @param temporalValidity the period in force
 */
public record Statute(
    String id,
    String title,
    List<Condition> preconditions,
    Effect effect,
    String discretionLogic,
    String jurisdiction,
    int version,
    TemporalValidity temporalValidity) {
  /** Creates a new Statute with a defensive copy of the preconditions. */
  public Statute {
    preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
    temporalValidity = temporalValidity == null ? TemporalValidity.unbounded() : temporalValidity;
  }
}
