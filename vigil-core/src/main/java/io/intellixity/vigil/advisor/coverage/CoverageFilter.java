package io.intellixity.vigil.advisor.coverage;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexFamily;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Drops candidate families that an existing index already serves. */
public final class CoverageFilter {

  public List<IndexFamily> retainUncovered(Collection<IndexFamily> candidates, Collection<ConcreteIndex> existing) {
    List<IndexFamily> out = new ArrayList<>();
    for (IndexFamily f : candidates) {
      if (!isCovered(f, existing)) out.add(f);
    }
    return out;
  }

  public static boolean isCovered(IndexFamily family, Collection<ConcreteIndex> existing) {
    if (existing == null) return false;
    for (ConcreteIndex i : existing) {
      if (i.covers(family)) return true;
    }
    return false;
  }
}
