package io.intellixity.vigil.lifecycle.jobs;

import io.intellixity.vigil.spi.jobs.JobArgs;

import java.util.Objects;

public record IndexDeletionArgs(String organizationId) implements JobArgs {
  public static final String KIND = "index_deletion";

  public IndexDeletionArgs {
    Objects.requireNonNull(organizationId, "organizationId");
  }

  @Override public String kind() { return KIND; }
}
