package io.intellixity.vigil.lifecycle;

import io.intellixity.vigil.advisor.model.ConcreteIndex;

import java.util.List;

/** Indexes a scenario iteration still needs, and how many builds are already running. */
public record IndexesToCreate(List<ConcreteIndex> indexes, int numPending) {
  public IndexesToCreate {
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
  }
}
