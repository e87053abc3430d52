package io.intellixity.vigil.advisor.model;

import java.util.Locale;

public enum IndexType {
  UNKNOWN,
  /** Index backing UI navigation (sorting/paging by a field). */
  NAVIGATION,
  /** Index created by the advisor to serve rule aggregations. */
  AGGREGATION;

  /** Name prefix used when generating index names. */
  public String namePrefix() {
    return this == NAVIGATION ? "nav" : "idx";
  }

  /** Classify an existing catalog index by the prefix of its name. */
  public static IndexType fromIndexName(String indexName) {
    if (indexName == null) return UNKNOWN;
    String n = indexName.toLowerCase(Locale.ROOT);
    if (n.startsWith("idx_")) return AGGREGATION;
    if (n.startsWith("nav_")) return NAVIGATION;
    return UNKNOWN;
  }
}
