package io.legalis.dsl.ast;

/**
 * The legal effect of a statute, from its {@code THEN} clause.
 *
 * @param effectType the effect keyword (GRANT, OBLIGATION, PROHIBIT or REVOKE)
 * @param description the effect text
 */
public record EffectNode(String effectType, String description) {}
