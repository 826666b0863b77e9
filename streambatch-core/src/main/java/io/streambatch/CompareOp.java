package io.streambatch;

/** Comparison operators accepted in filter expressions. */
public enum CompareOp {
  EQ("="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  private final String symbol;

  CompareOp(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Applies the operator to the result of a three-way comparison. */
  boolean accepts(int comparison) {
    switch (this) {
      case EQ:
        return comparison == 0;
      case NE:
        return comparison != 0;
      case LT:
        return comparison < 0;
      case LE:
        return comparison <= 0;
      case GT:
        return comparison > 0;
      case GE:
        return comparison >= 0;
      default:
        throw new IllegalStateException("Unhandled operator " + this);
    }
  }

  /**
   * Looks up an operator by symbol. {@code ==} is accepted for {@link #EQ} and {@code <>} for
   * {@link #NE}.
   *
   * @throws ConfigurationException for an unknown symbol
   */
  public static CompareOp fromSymbol(String symbol) {
    switch (symbol) {
      case "=":
      case "==":
        return EQ;
      case "!=":
      case "<>":
        return NE;
      case "<":
        return LT;
      case "<=":
        return LE;
      case ">":
        return GT;
      case ">=":
        return GE;
      default:
        throw new ConfigurationException("Unknown comparison operator: " + symbol);
    }
  }
}
