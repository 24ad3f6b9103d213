package io.legalis.dsl.ast;

/**
 * A statute's amendment of another statute.
 *
 * @param targetId the amended statute
 * @param version the version the amendment produces (may be null)
 * @param date the effective date as unpadded "Y-M-D" text (may be null)
 * @param description the amendment text
 */
public record AmendmentClause(String targetId, Integer version, String date, String description) {}
