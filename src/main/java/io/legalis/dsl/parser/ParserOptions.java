package io.legalis.dsl.parser;

import io.legalis.dsl.lower.LoweringPolicy;

/**
 * Tuning knobs for {@link DocumentParser}.
 *
 * @param maxNestingDepth how deeply parentheses and NOT may nest before parsing fails
 * @param resolveReferences whether REQUIRES, SUPERSEDES and AMENDMENT targets must resolve within
 *     the document or through an import alias
 * @param loweringPolicy how {@link DocumentParser#parseStatute} treats conditions that have no
 *     downstream equivalent
 */
public record ParserOptions(
    int maxNestingDepth, boolean resolveReferences, LoweringPolicy loweringPolicy) {
  /** The nesting limit used by {@link #defaults()}. */
  public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

  /** Validates the options. */
  public ParserOptions {
    if (maxNestingDepth < 1) {
      throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
    }
    if (loweringPolicy == null) {
      loweringPolicy = LoweringPolicy.BEST_EFFORT;
    }
  }

  /**
   * Returns the default options: nesting up to 256 levels, unresolved references allowed,
   * best-effort lowering.
   *
   * @return the default options
   */
  public static ParserOptions defaults() {
    return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH, false, LoweringPolicy.BEST_EFFORT);
  }

  /**
   * Returns a copy with the specified nesting limit.
   *
   * @param maxNestingDepth the nesting limit
   * @return new options with the updated limit
   */
  public ParserOptions withMaxNestingDepth(int maxNestingDepth) {
    return new ParserOptions(maxNestingDepth, resolveReferences, loweringPolicy);
  }

  /**
   * Returns a copy with reference resolution switched on or off.
   *
   * @param resolveReferences whether references must resolve
   * @return new options with the updated flag
   */
  public ParserOptions withResolveReferences(boolean resolveReferences) {
    return new ParserOptions(maxNestingDepth, resolveReferences, loweringPolicy);
  }

  /**
   * Returns a copy with the specified lowering policy.
   *
   * @param loweringPolicy the policy
   * @return new options with the updated policy
   */
  public ParserOptions withLoweringPolicy(LoweringPolicy loweringPolicy) {
    return new ParserOptions(maxNestingDepth, resolveReferences, loweringPolicy);
  }
}
