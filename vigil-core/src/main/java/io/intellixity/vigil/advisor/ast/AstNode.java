package io.intellixity.vigil.advisor.ast;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;
import java.util.function.Consumer;

/**
 * Rule expression node as stored with a scenario iteration.\n
 *
 * A node is either a constant leaf (empty name) or a function application with positional
 * and/or named children.\n
 */
@JsonSerialize(using = AstNodeJsonSerializer.class)
@JsonDeserialize(using = AstNodeJsonDeserializer.class)
public final class AstNode {
  private final String name;
  private final Object constant;
  private final List<AstNode> children;
  private final SortedMap<String, AstNode> namedChildren;

  public AstNode(String name, Object constant, List<AstNode> children, Map<String, AstNode> namedChildren) {
    this.name = name == null ? "" : name;
    this.constant = constant;
    this.children = children == null ? List.of() : List.copyOf(children);
    this.namedChildren = Collections.unmodifiableSortedMap(
        new TreeMap<>(namedChildren == null ? Map.of() : namedChildren));
  }

  public static AstNode constant(Object value) {
    return new AstNode("", value, null, null);
  }

  public static AstNode of(AstFunction function, List<AstNode> children) {
    return new AstNode(function.wireName(), null, children, null);
  }

  public static AstNode of(AstFunction function, Map<String, AstNode> namedChildren) {
    return new AstNode(function.wireName(), null, null, namedChildren);
  }

  /** Aggregator over {@code table.field} restricted by the given filter nodes. */
  public static AstNode aggregator(String table, String field, String aggregator, List<AstNode> filters) {
    Map<String, AstNode> named = new LinkedHashMap<>();
    named.put("aggregator", constant(aggregator));
    named.put("tableName", constant(table));
    named.put("fieldName", constant(field));
    named.put("label", constant(aggregator + " " + table + "." + field));
    if (filters != null) named.put("filters", of(AstFunction.LIST, filters));
    return of(AstFunction.AGGREGATOR, named);
  }

  public static AstNode filter(String table, String field, String operator, Object value) {
    Map<String, AstNode> named = new LinkedHashMap<>();
    named.put("tableName", constant(table));
    named.put("fieldName", constant(field));
    named.put("operator", constant(operator));
    named.put("value", constant(value));
    return of(AstFunction.FILTER, named);
  }

  public String name() { return name; }
  public Object constant() { return constant; }
  public List<AstNode> children() { return children; }
  public Map<String, AstNode> namedChildren() { return namedChildren; }

  public AstFunction function() { return AstFunction.fromWireName(name); }
  public boolean isConstant() { return name.isEmpty(); }

  public AstNode namedChild(String key) {
    return namedChildren.get(key);
  }

  /** Read a named child that must be a string constant. */
  public String readConstantNamedChildString(String key) {
    Objects.requireNonNull(key, "key");
    AstNode child = namedChildren.get(key);
    if (child == null) {
      throw new InvalidAstException("Node '" + name + "' has no named child '" + key + "'");
    }
    if (!child.isConstant() || !(child.constant instanceof String s)) {
      throw new InvalidAstException("Named child '" + key + "' of node '" + name + "' is not a string constant");
    }
    return s;
  }

  /** Depth-first pre-order walk: this node, positional children, then named children by key. */
  public void walk(Consumer<AstNode> visitor) {
    Objects.requireNonNull(visitor, "visitor");
    visitor.accept(this);
    for (AstNode c : children) c.walk(visitor);
    for (AstNode c : namedChildren.values()) c.walk(visitor);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AstNode n)) return false;
    return name.equals(n.name)
        && Objects.equals(constant, n.constant)
        && children.equals(n.children)
        && namedChildren.equals(n.namedChildren);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, constant, children, namedChildren);
  }

  @Override
  public String toString() {
    if (isConstant()) return String.valueOf(constant);
    return name + children + (namedChildren.isEmpty() ? "" : namedChildren.toString());
  }
}
