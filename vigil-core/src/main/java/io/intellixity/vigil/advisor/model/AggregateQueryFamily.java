package io.intellixity.vigil.advisor.model;

import java.util.*;

/**
 * Shape of one historical aggregation: the table it reads and how each referenced column is
 * constrained.\n
 *
 * The three column buckets are pairwise disjoint, comparing names case-insensitively. Equality
 * wins over range, range wins over everything else.\n
 */
public final class AggregateQueryFamily implements Comparable<AggregateQueryFamily> {
  private final String table;
  private final SortedSet<String> eqConditions;
  private final SortedSet<String> ineqConditions;
  private final SortedSet<String> selectOrOtherConditions;
  private final String key;

  public AggregateQueryFamily(String table, Set<String> eq, Set<String> ineq, Set<String> selectOrOther) {
    this.table = Objects.requireNonNull(table, "table");
    this.eqConditions = frozen(eq);
    this.ineqConditions = frozen(ineq);
    this.selectOrOtherConditions = frozen(selectOrOther);
    requireDisjoint("eq", eqConditions, "ineq", ineqConditions);
    requireDisjoint("eq", eqConditions, "other", selectOrOtherConditions);
    requireDisjoint("ineq", ineqConditions, "other", selectOrOtherConditions);
    this.key = Identifiers.keyOf(table) + " " + Identifiers.keyOf(eqConditions) + " "
        + Identifiers.keyOf(ineqConditions) + " " + Identifiers.keyOf(selectOrOtherConditions);
  }

  public static Builder builder(String table) {
    return new Builder(table);
  }

  public String table() { return table; }
  public SortedSet<String> eqConditions() { return eqConditions; }
  public SortedSet<String> ineqConditions() { return ineqConditions; }
  public SortedSet<String> selectOrOtherConditions() { return selectOrOtherConditions; }

  /** Canonical dedup key: table plus the sorted content of each bucket. */
  public String key() { return key; }

  @Override
  public int compareTo(AggregateQueryFamily o) {
    return key.compareTo(o.key);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof AggregateQueryFamily f && key.equals(f.key));
  }

  @Override
  public int hashCode() { return key.hashCode(); }

  @Override
  public String toString() { return "AggregateQueryFamily{" + key + "}"; }

  private static SortedSet<String> frozen(Set<String> s) {
    return Collections.unmodifiableSortedSet(new TreeSet<>(s == null ? Set.of() : s));
  }

  private static void requireDisjoint(String an, Set<String> a, String bn, Set<String> b) {
    Set<String> other = Identifiers.normalizeToSet(b);
    for (String x : a) {
      if (other.contains(Identifiers.normalize(x))) {
        throw new IllegalArgumentException("Field '" + x + "' is in both " + an + " and " + bn + " conditions");
      }
    }
  }

  /**
   * Classifies columns while keeping the bucket precedence whatever the insertion order. Names
   * are matched case-insensitively and keep the first spelling seen.
   */
  public static final class Builder {
    private final String table;
    private final Map<String, String> spellings = new HashMap<>();
    private final Set<String> eq = new HashSet<>();
    private final Set<String> ineq = new HashSet<>();
    private final Set<String> other = new HashSet<>();

    private Builder(String table) {
      this.table = Objects.requireNonNull(table, "table");
    }

    public Builder eq(String field) {
      String k = register(field);
      eq.add(k);
      ineq.remove(k);
      other.remove(k);
      return this;
    }

    public Builder ineq(String field) {
      String k = register(field);
      if (eq.contains(k)) return this;
      ineq.add(k);
      other.remove(k);
      return this;
    }

    public Builder other(String field) {
      String k = register(field);
      if (eq.contains(k) || ineq.contains(k)) return this;
      other.add(k);
      return this;
    }

    private String register(String field) {
      Objects.requireNonNull(field, "field");
      String k = Identifiers.normalize(field);
      spellings.putIfAbsent(k, field);
      return k;
    }

    private Set<String> spelled(Set<String> keys) {
      Set<String> out = new TreeSet<>();
      for (String k : keys) out.add(spellings.get(k));
      return out;
    }

    public AggregateQueryFamily build() {
      return new AggregateQueryFamily(table, spelled(eq), spelled(ineq), spelled(other));
    }
  }
}
