package io.legalis.dsl.lower;

import java.time.LocalDate;

/**
 * The period during which a statute is in force.
 *
 * @param effectiveDate the first day in force (may be null)
 * @param expiryDate the day the statute lapses (may be null)
 */
public record TemporalValidity(LocalDate effectiveDate, LocalDate expiryDate) {
  /**
   * Returns a validity without bounds.
   *
   * @return an unbounded validity
   */
  public static TemporalValidity unbounded() {
    return new TemporalValidity(null, null);
  }
}
