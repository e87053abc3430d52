package io.intellixity.vigil.spi.jobs;

import java.time.Instant;
import java.util.Objects;

/** A job handed to a worker. {@code attempt} starts at 1. */
public record Job<A extends JobArgs>(long id, A args, int attempt, Instant scheduledAt) {
  public Job {
    Objects.requireNonNull(args, "args");
  }
}
