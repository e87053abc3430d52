package io.intellixity.vigil.advisor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * A physical index: either read from a tenant catalog or proposed for creation.\n
 *
 * Equality is structural (table, ordered key columns, included columns as a set); name, type
 * and status are ignored.\n
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConcreteIndex {
  private final String tableName;
  private final String name;
  private final List<String> indexed;
  private final List<String> included;
  private final IndexType type;
  private final IndexStatus status;

  @JsonCreator
  public ConcreteIndex(@JsonProperty("tableName") String tableName,
                       @JsonProperty("indexName") String name,
                       @JsonProperty("indexed") List<String> indexed,
                       @JsonProperty("included") List<String> included,
                       @JsonProperty("type") IndexType type,
                       @JsonProperty("status") IndexStatus status) {
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    this.name = (name == null || name.isBlank()) ? null : name;
    this.indexed = List.copyOf(indexed == null ? List.of() : indexed);
    this.included = List.copyOf(included == null ? List.of() : included);
    this.type = type == null ? IndexType.UNKNOWN : type;
    this.status = status == null ? IndexStatus.UNKNOWN : status;
  }

  /** Unnamed aggregation index, as produced by the advisor. */
  public static ConcreteIndex aggregation(String tableName, List<String> indexed, List<String> included) {
    return new ConcreteIndex(tableName, null, indexed, included, IndexType.AGGREGATION, IndexStatus.UNKNOWN);
  }

  @JsonProperty("tableName") public String tableName() { return tableName; }
  /** Physical name, or null before submission. */
  @JsonProperty("indexName") public String name() { return name; }
  @JsonProperty("indexed") public List<String> indexed() { return indexed; }
  @JsonProperty("included") public List<String> included() { return included; }
  @JsonProperty("type") public IndexType type() { return type; }
  @JsonProperty("status") public IndexStatus status() { return status; }

  public ConcreteIndex withName(String name) {
    return new ConcreteIndex(tableName, name, indexed, included, type, status);
  }

  public ConcreteIndex withStatus(IndexStatus status) {
    return new ConcreteIndex(tableName, name, indexed, included, type, status);
  }

  /**
   * Whether this index can serve every query of {@code family}.\n
   *
   * Prefix semantics: the index may carry more key columns after the ones the family needs.
   * Names compare case-insensitively.\n
   */
  public boolean covers(IndexFamily family) {
    Objects.requireNonNull(family, "family");
    if (!Identifiers.same(tableName, family.tableName())) return false;

    List<String> idx = Identifiers.normalize(indexed);
    List<String> fixed = Identifiers.normalize(family.fixed());
    if (idx.size() < fixed.size()) return false;
    if (!idx.subList(0, fixed.size()).equals(fixed)) return false;

    Set<String> flex = Identifiers.normalizeToSet(family.flex());
    if (!flex.isEmpty()) {
      int start = fixed.size();
      if (start + flex.size() > idx.size()) return false;
      if (!new HashSet<>(idx.subList(start, start + flex.size())).equals(flex)) return false;
    }

    if (family.hasLast()) {
      int size = family.size();
      if (size > idx.size() || !idx.get(size - 1).equals(Identifiers.normalize(family.last()))) return false;
    }

    Set<String> stored = new HashSet<>(idx);
    stored.addAll(Identifiers.normalizeToSet(included));
    return stored.containsAll(Identifiers.normalizeToSet(family.included()));
  }

  /**
   * True when {@code other} makes this index redundant: same table, this key is a strict-or-equal
   * prefix of the other's key and every column stored here is stored there too.\n
   */
  public boolean isSubsumedBy(ConcreteIndex other) {
    if (!Identifiers.same(tableName, other.tableName)) return false;
    List<String> mine = Identifiers.normalize(indexed);
    List<String> theirs = Identifiers.normalize(other.indexed);
    if (mine.size() > theirs.size() || !theirs.subList(0, mine.size()).equals(mine)) return false;
    Set<String> stored = new HashSet<>(theirs);
    stored.addAll(Identifiers.normalizeToSet(other.included));
    return stored.containsAll(Identifiers.normalizeToSet(included));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ConcreteIndex i)) return false;
    return tableName.equals(i.tableName)
        && indexed.equals(i.indexed)
        && new HashSet<>(included).equals(new HashSet<>(i.included));
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableName, indexed, new HashSet<>(included));
  }

  @Override
  public String toString() {
    return "ConcreteIndex{table=" + tableName + ", name=" + name + ", indexed=" + indexed
        + ", included=" + included + ", type=" + type + ", status=" + status + "}";
  }
}
