package io.intellixity.vigil.lifecycle.jobs;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.spi.jobs.JobArgs;

import java.util.List;
import java.util.Objects;

public record IndexCreationStatusArgs(String organizationId, List<ConcreteIndex> indexes, boolean resubmission) implements JobArgs {
  public static final String KIND = "index_creation_status";

  public IndexCreationStatusArgs {
    Objects.requireNonNull(organizationId, "organizationId");
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
  }

  @Override public String kind() { return KIND; }
}
