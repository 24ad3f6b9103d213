package io.legalis.dsl.lower;

import java.util.Optional;

/** A comparison operator of the downstream condition model. */
public enum ComparisonOp {
  EQUAL("=="),
  NOT_EQUAL("!="),
  GREATER_THAN(">"),
  GREATER_OR_EQUAL(">="),
  LESS_THAN("<"),
  LESS_OR_EQUAL("<=");

  private final String symbol;

  ComparisonOp(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Returns the DSL spelling of the operator.
   *
   * @return the symbol, e.g. "&gt;="
   */
  public String symbol() {
    return symbol;
  }

  /**
   * Looks up an operator by its DSL spelling.
   *
   * @param symbol the symbol
   * @return the operator, or empty if the symbol is unknown
   */
  public static Optional<ComparisonOp> fromSymbol(String symbol) {
    for (ComparisonOp op : values()) {
      if (op.symbol.equals(symbol)) {
        return Optional.of(op);
      }
    }
    return Optional.empty();
  }
}
