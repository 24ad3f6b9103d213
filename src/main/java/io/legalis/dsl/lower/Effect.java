package io.legalis.dsl.lower;

/**
 * The effect of a lowered statute.
 *
 * @param type the effect type
 * @param description the effect text
 */
public record Effect(EffectType type, String description) {}
