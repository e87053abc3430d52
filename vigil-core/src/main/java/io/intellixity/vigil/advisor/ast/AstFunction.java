package io.intellixity.vigil.advisor.ast;

import java.util.HashMap;
import java.util.Map;

/** Function tag of an {@link AstNode}, keyed by its wire name. */
public enum AstFunction {
  UNDEFINED(""),
  AND("And"),
  OR("Or"),
  NOT("Not"),
  EQUAL("="),
  NOT_EQUAL("!="),
  GREATER(">"),
  GREATER_OR_EQUAL(">="),
  LESS("<"),
  LESS_OR_EQUAL("<="),
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  IS_IN_LIST("IsInList"),
  IS_NOT_IN_LIST("IsNotInList"),
  PAYLOAD("Payload"),
  DATABASE_ACCESS("DatabaseAccess"),
  CUSTOM_LIST_ACCESS("CustomListAccess"),
  AGGREGATOR("Aggregator"),
  FILTER("Filter"),
  LIST("List");

  private static final Map<String, AstFunction> BY_NAME = new HashMap<>();

  static {
    for (AstFunction f : values()) BY_NAME.put(f.wireName, f);
  }

  private final String wireName;

  AstFunction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  /** Unknown names map to {@link #UNDEFINED}; the node keeps its raw name. */
  public static AstFunction fromWireName(String name) {
    if (name == null) return UNDEFINED;
    return BY_NAME.getOrDefault(name, UNDEFINED);
  }
}
