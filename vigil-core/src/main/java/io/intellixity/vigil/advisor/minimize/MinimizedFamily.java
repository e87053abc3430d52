package io.intellixity.vigil.advisor.minimize;

import io.intellixity.vigil.advisor.model.IndexFamily;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of minimization for one output index.
 *
 * @param family   merged family
 * @param sources  candidate families folded into it, in processing order
 * @param keyOrder key column order that serves every source
 */
public record MinimizedFamily(IndexFamily family, List<IndexFamily> sources, List<String> keyOrder) {
  public MinimizedFamily {
    Objects.requireNonNull(family, "family");
    sources = List.copyOf(sources);
    keyOrder = List.copyOf(keyOrder);
  }
}
