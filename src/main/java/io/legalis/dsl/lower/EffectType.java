package io.legalis.dsl.lower;

/** The kind of legal effect a statute produces. */
public enum EffectType {
  GRANT,
  REVOKE,
  OBLIGATION,
  PROHIBITION
}
