package io.intellixity.vigil.advisor.project;

import io.intellixity.vigil.advisor.minimize.MinimizedFamily;
import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexFamily;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Turns minimized families into unnamed aggregation indexes. */
public final class ConcreteIndexProjector {

  public List<ConcreteIndex> project(Collection<MinimizedFamily> families) {
    List<ConcreteIndex> out = new ArrayList<>(families.size());
    for (MinimizedFamily f : families) {
      out.add(ConcreteIndex.aggregation(f.family().tableName(), f.keyOrder(), List.copyOf(f.family().included())));
    }
    return out;
  }

  /** Canonical physical layout of a lone family: fixed, then flex sorted, then last. */
  public ConcreteIndex project(IndexFamily family) {
    List<String> indexed = new ArrayList<>(family.fixed());
    indexed.addAll(family.flex());
    if (family.hasLast()) indexed.add(family.last());
    return ConcreteIndex.aggregation(family.tableName(), indexed, List.copyOf(family.included()));
  }
}
