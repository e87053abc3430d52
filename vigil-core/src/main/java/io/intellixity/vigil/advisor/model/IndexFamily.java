package io.intellixity.vigil.advisor.model;

import java.util.*;

/**
 * Set of physical composite indexes that all serve the same query shape.\n
 *
 * Key layout: {@code fixed} columns in this exact order, then the {@code flex} columns in any
 * order, then {@code last} if present. {@code included} columns only have to be stored in the
 * index (key or INCLUDE) and never overlap the key columns.\n
 */
public final class IndexFamily implements Comparable<IndexFamily> {
  private final String tableName;
  private final List<String> fixed;
  private final SortedSet<String> flex;
  private final String last;
  private final SortedSet<String> included;
  private final String key;

  private IndexFamily(String tableName, List<String> fixed, Set<String> flex, String last, Set<String> included) {
    this.tableName = tableName;
    this.fixed = List.copyOf(fixed);
    this.flex = Collections.unmodifiableSortedSet(new TreeSet<>(flex));
    this.last = last;
    TreeSet<String> inc = new TreeSet<>(included);
    inc.removeAll(this.fixed);
    inc.removeAll(this.flex);
    if (last != null) inc.remove(last);
    this.included = Collections.unmodifiableSortedSet(inc);
    this.key = Identifiers.keyOf(tableName) + " " + Identifiers.keyOf(this.fixed) + " " + Identifiers.keyOf(this.flex)
        + " " + Identifiers.keyOf(last) + " " + Identifiers.keyOf(this.included);
  }

  public static Builder builder(String tableName) {
    return new Builder(tableName);
  }

  public Builder toBuilder() {
    Builder b = new Builder(tableName);
    b.fixed.addAll(fixed);
    b.flex.addAll(flex);
    b.last = last;
    b.included.addAll(included);
    return b;
  }

  public String tableName() { return tableName; }
  public List<String> fixed() { return fixed; }
  public SortedSet<String> flex() { return flex; }
  /** Trailing range column, or null. */
  public String last() { return last; }
  public boolean hasLast() { return last != null; }
  public SortedSet<String> included() { return included; }

  public int size() {
    return fixed.size() + flex.size() + (last == null ? 0 : 1);
  }

  /** Every key column: fixed, flex and last. */
  public Set<String> allIndexedValues() {
    Set<String> out = new TreeSet<>(fixed);
    out.addAll(flex);
    if (last != null) out.add(last);
    return out;
  }

  /** Canonical structural key, used for dedup and for a reproducible processing order. */
  public String key() { return key; }

  @Override
  public int compareTo(IndexFamily o) {
    return key.compareTo(o.key);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof IndexFamily f && key.equals(f.key));
  }

  @Override
  public int hashCode() { return key.hashCode(); }

  @Override
  public String toString() {
    return "IndexFamily{table=" + tableName + ", fixed=" + fixed + ", flex=" + flex
        + ", last=" + last + ", included=" + included + "}";
  }

  /** Mutable draft of a family; {@link #build()} checks the layout invariants. */
  public static final class Builder {
    private final String tableName;
    private final List<String> fixed = new ArrayList<>();
    private final SortedSet<String> flex = new TreeSet<>();
    private String last;
    private final SortedSet<String> included = new TreeSet<>();

    private Builder(String tableName) {
      this.tableName = Objects.requireNonNull(tableName, "tableName");
    }

    public Builder fixed(String... columns) { return addFixed(Arrays.asList(columns)); }
    public Builder addFixed(Collection<String> columns) { fixed.addAll(columns); return this; }
    public Builder clearFixed() { fixed.clear(); return this; }
    public Builder flex(String... columns) { return addFlex(Arrays.asList(columns)); }
    public Builder addFlex(Collection<String> columns) { flex.addAll(columns); return this; }
    public Builder removeFlex(Collection<String> columns) { flex.removeAll(columns); return this; }
    public Builder clearFlex() { flex.clear(); return this; }
    public Builder included(String... columns) { return addIncluded(Arrays.asList(columns)); }
    public Builder addIncluded(Collection<String> columns) { included.addAll(columns); return this; }

    /** Set (or clear, with null/empty) the trailing column. It leaves flex and included. */
    public Builder last(String column) {
      this.last = (column == null || column.isEmpty()) ? null : column;
      if (this.last != null) {
        flex.remove(this.last);
        included.remove(this.last);
      }
      return this;
    }

    public List<String> fixed() { return Collections.unmodifiableList(fixed); }
    public SortedSet<String> flex() { return Collections.unmodifiableSortedSet(flex); }
    public String last() { return last; }

    /** True when fixed has no duplicates, flex is disjoint from fixed and last is in neither. */
    public boolean isWellFormed() {
      Set<String> seen = new HashSet<>(fixed);
      if (seen.size() != fixed.size()) return false;
      for (String f : flex) if (seen.contains(f)) return false;
      return last == null || (!seen.contains(last) && !flex.contains(last));
    }

    public IndexFamily build() {
      if (!isWellFormed()) {
        throw new IllegalStateException("Malformed index family on " + tableName
            + ": fixed=" + fixed + ", flex=" + flex + ", last=" + last);
      }
      return new IndexFamily(tableName, fixed, flex, last, included);
    }
  }
}
