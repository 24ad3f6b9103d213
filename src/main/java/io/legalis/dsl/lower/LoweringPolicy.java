package io.legalis.dsl.lower;

/** What to do with a condition that has no equivalent in the downstream {@link Condition} model. */
public enum LoweringPolicy {
  /** Fail with an {@link io.legalis.dsl.ErrorKind#INVALID_CONDITION} error. */
  STRICT,
  /** Keep the condition as a {@link Condition.Custom} holding its DSL text. */
  BEST_EFFORT
}
