package io.intellixity.sift.spi.search;

public enum ComparisonOperator {
  GTE(">="), LTE("<="), GT(">"), LT("<");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }

  /** The operator matching the negated comparison. */
  public ComparisonOperator complement() {
    return switch (this) {
      case GTE -> LT;
      case LTE -> GT;
      case GT -> LTE;
      case LT -> GTE;
    };
  }

  /** Longest prefix first so {@code >=5} is not read as {@code >} {@code =5}. */
  static ComparisonOperator prefixOf(String value) {
    for (ComparisonOperator op : new ComparisonOperator[]{GTE, LTE, GT, LT}) {
      if (value.startsWith(op.symbol) && value.length() > op.symbol.length()) return op;
    }
    return null;
  }
}
