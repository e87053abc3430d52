package io.intellixity.vigil.jdbc.dialect;

import io.intellixity.vigil.util.VigilFactoriesLoader;

import java.util.*;

/** Dialects registered in {@code META-INF/vigil.factories}, looked up by id. */
public final class IndexDialects {
  private IndexDialects() {}

  public static List<IndexDialect> discovered() {
    return VigilFactoriesLoader.load(IndexDialect.class);
  }

  public static IndexDialect byId(String id) {
    Objects.requireNonNull(id, "id");
    List<String> known = new ArrayList<>();
    for (IndexDialect d : discovered()) {
      if (d.id().equalsIgnoreCase(id.trim())) return d;
      known.add(d.id());
    }
    throw new IllegalArgumentException("Unknown index dialect '" + id + "', known: " + known);
  }
}
