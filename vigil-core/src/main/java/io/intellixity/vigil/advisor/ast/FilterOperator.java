package io.intellixity.vigil.advisor.ast;

import java.util.HashMap;
import java.util.Map;

/** Operators allowed inside an aggregator's filter list. */
public enum FilterOperator {
  EQUAL("=", Kind.EQUALITY),
  NOT_EQUAL("!=", Kind.OTHER),
  GREATER(">", Kind.RANGE),
  GREATER_OR_EQUAL(">=", Kind.RANGE),
  LESS("<", Kind.RANGE),
  LESS_OR_EQUAL("<=", Kind.RANGE),
  IS_IN_LIST("IsInList", Kind.OTHER),
  IS_NOT_IN_LIST("IsNotInList", Kind.OTHER),
  IS_EMPTY("IsEmpty", Kind.OTHER),
  IS_NOT_EMPTY("IsNotEmpty", Kind.OTHER),
  STRING_STARTS_WITH("StringStartsWith", Kind.OTHER),
  STRING_ENDS_WITH("StringEndsWith", Kind.OTHER),
  STRING_CONTAINS("StringContains", Kind.OTHER),
  STRING_NOT_CONTAINS("StringNotContains", Kind.OTHER);

  /** How a filter on a column can use a composite index. */
  public enum Kind {
    /** Pins the column to one value; any position in the equality block works. */
    EQUALITY,
    /** Range scan; only usable as the column right after the equality block. */
    RANGE,
    /** Evaluated on the fetched row; the column only needs to be available. */
    OTHER
  }

  private static final Map<String, FilterOperator> BY_SYMBOL = new HashMap<>();

  static {
    for (FilterOperator op : values()) BY_SYMBOL.put(op.symbol, op);
  }

  private final String symbol;
  private final Kind kind;

  FilterOperator(String symbol, Kind kind) {
    this.symbol = symbol;
    this.kind = kind;
  }

  public String symbol() { return symbol; }
  public Kind kind() { return kind; }

  public static FilterOperator fromSymbol(String symbol) {
    FilterOperator op = symbol == null ? null : BY_SYMBOL.get(symbol);
    if (op == null) throw new InvalidAstException("Filter operator " + symbol + " is not valid");
    return op;
  }
}
