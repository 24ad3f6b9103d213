package io.legalis.dsl.lexer;

/** The type of token. */
public enum TokenKind {
  // Structure keywords
  /** The "STATUTE" keyword. */
  STATUTE,
  /** The "IMPORT" keyword. */
  IMPORT,
  /** The "AS" keyword. */
  AS,

  // Clause keywords
  /** The "WHEN" keyword. */
  WHEN,
  /** The "UNLESS" keyword. */
  UNLESS,
  /** The "THEN" keyword. */
  THEN,
  /** The "DISCRETION" keyword. */
  DISCRETION,
  /** The "EXCEPTION" keyword. */
  EXCEPTION,
  /** The deprecated "EXCEPT" keyword. */
  EXCEPT,
  /** The "AMENDMENT" keyword. */
  AMENDMENT,
  /** The deprecated "AMENDS" keyword. */
  AMENDS,
  /** The "SUPERSEDES" keyword. */
  SUPERSEDES,
  /** The deprecated "REPLACES" keyword. */
  REPLACES,
  /** The "REQUIRES" keyword. */
  REQUIRES,
  /** The "DEFAULT" keyword. */
  DEFAULT,
  /** The "JURISDICTION" keyword. */
  JURISDICTION,
  /** The "VERSION" keyword. */
  VERSION,
  /** The "EFFECTIVE_DATE" keyword (also "EFFECTIVE"). */
  EFFECTIVE_DATE,
  /** The "EXPIRY_DATE" keyword (also "EXPIRES"). */
  EXPIRY_DATE,

  // Effect types
  /** The "GRANT" effect. */
  GRANT,
  /** The "OBLIGATION" effect. */
  OBLIGATION,
  /** The "PROHIBIT" effect. */
  PROHIBIT,
  /** The "REVOKE" effect. */
  REVOKE,

  // Condition keywords
  /** The "AND" keyword. */
  AND,
  /** The "OR" keyword. */
  OR,
  /** The "NOT" keyword. */
  NOT,
  /** The "HAS" keyword. */
  HAS,
  /** The "BETWEEN" keyword. */
  BETWEEN,
  /** The "IN" keyword. */
  IN,
  /** The "LIKE" keyword. */
  LIKE,
  /** The "MATCHES" keyword (also "MATCH"). */
  MATCHES,
  /** The "IN_RANGE" keyword. */
  IN_RANGE,
  /** The "NOT_IN_RANGE" keyword. */
  NOT_IN_RANGE,
  /** The "CURRENT_DATE" keyword (also "NOW" and "TODAY"). */
  CURRENT_DATE,
  /** The "DATE_FIELD" keyword. */
  DATE_FIELD,

  // Value-carrying tokens
  /** An identifier, possibly dotted (e.g., "applicant.age"). */
  IDENT,
  /** A double-quoted string literal. */
  STRING,
  /** A signed integer literal. */
  NUMBER,
  /** A bare ISO date (e.g., "2024-01-15"). */
  DATE,

  // Punctuation
  /** "(". */
  LPAREN,
  /** ")". */
  RPAREN,
  /** "{". */
  LBRACE,
  /** "}". */
  RBRACE,
  /** "[". */
  LBRACKET,
  /** "]". */
  RBRACKET,
  /** ",". */
  COMMA,
  /** ":". */
  COLON,
  /** A lone ".". */
  DOT,
  /** "..", an inclusive range marker. */
  RANGE,
  /** "...", a range marker that excludes the upper bound. */
  RANGE_EXCLUSIVE,
  /** "=", used by DEFAULT. */
  ASSIGN,

  // Comparison operators
  /** "==". */
  EQ,
  /** "!=". */
  NE,
  /** "&gt;". */
  GT,
  /** "&gt;=". */
  GE,
  /** "&lt;". */
  LT,
  /** "&lt;=". */
  LE,

  /** End of input. */
  EOF;

  /**
   * Returns true for the six comparison operators.
   *
   * @return whether this kind is a comparison operator
   */
  public boolean isComparison() {
    return this == EQ || this == NE || this == GT || this == GE || this == LT || this == LE;
  }

  /**
   * Returns true for the four effect type keywords.
   *
   * @return whether this kind names an effect type
   */
  public boolean isEffectType() {
    return this == GRANT || this == OBLIGATION || this == PROHIBIT || this == REVOKE;
  }
}
