package io.legalis.dsl.ast;

import java.time.LocalDate;
import java.util.List;

/**
 * Represents one parsed {@code STATUTE} block.
 *
 * @param id the statute identifier
 * @param title the statute title
 * @param jurisdiction the jurisdiction (may be null)
 * @param version the version, 1 unless declared
 * @param effectiveDate the date the statute takes effect (may be null)
 * @param expiryDate the date the statute lapses (may be null)
 * @param conditions the eligibility condition; empty, or a single node conjoining every WHEN and
 *     UNLESS clause
 * @param effect the legal effect
 * @param discretion guidance for human decision-makers (may be null)
 * @param exceptions the exception clauses
 * @param amendments the amendment clauses
 * @param supersedes ids of statutes this one replaces, as written
 * @param requires ids of statutes this one depends on, as written
 * @param defaults default values for input fields
 */
public record StatuteNode(
    String id,
    String title,
    String jurisdiction,
    int version,
    LocalDate effectiveDate,
    LocalDate expiryDate,
    List<ConditionNode> conditions,
    EffectNode effect,
    String discretion,
    List<ExceptionClause> exceptions,
    List<AmendmentClause> amendments,
    List<String> supersedes,
    List<String> requires,
    List<DefaultClause> defaults) {
  /** Creates a new StatuteNode with defensive copies of lists. */
  public StatuteNode {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
    amendments = amendments == null ? List.of() : List.copyOf(amendments);
    supersedes = supersedes == null ? List.of() : List.copyOf(supersedes);
    requires = requires == null ? List.of() : List.copyOf(requires);
    defaults = defaults == null ? List.of() : List.copyOf(defaults);
  }

  /**
   * Creates a statute with only an id, title and effect; everything else takes its default.
   *
   * @param id the statute identifier
   * @param title the statute title
   * @param effect the legal effect
   * @return a new StatuteNode
   */
  public static StatuteNode of(String id, String title, EffectNode effect) {
    return new StatuteNode(
        id, title, null, 1, null, null, List.of(), effect, null, List.of(), List.of(), List.of(),
        List.of(), List.of());
  }

  /**
   * Returns a copy with the specified conditions.
   *
   * @param conditions the conditions
   * @return a new StatuteNode with the updated conditions
   */
  public StatuteNode withConditions(List<ConditionNode> conditions) {
    return new StatuteNode(
        id, title, jurisdiction, version, effectiveDate, expiryDate, conditions, effect,
        discretion, exceptions, amendments, supersedes, requires, defaults);
  }

  /**
   * Returns a copy with the specified jurisdiction.
   *
   * @param jurisdiction the jurisdiction
   * @return a new StatuteNode with the updated jurisdiction
   */
  public StatuteNode withJurisdiction(String jurisdiction) {
    return new StatuteNode(
        id, title, jurisdiction, version, effectiveDate, expiryDate, conditions, effect,
        discretion, exceptions, amendments, supersedes, requires, defaults);
  }

  /**
   * Returns a copy with the specified requirements.
   *
   * @param requires ids of required statutes
   * @return a new StatuteNode with the updated requirements
   */
  public StatuteNode withRequires(List<String> requires) {
    return new StatuteNode(
        id, title, jurisdiction, version, effectiveDate, expiryDate, conditions, effect,
        discretion, exceptions, amendments, supersedes, requires, defaults);
  }
}
