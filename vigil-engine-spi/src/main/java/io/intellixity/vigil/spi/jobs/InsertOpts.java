package io.intellixity.vigil.spi.jobs;

import java.time.Instant;
import java.util.Objects;

/**
 * Enqueue options.\n
 *
 * @param queue       lane name; one lane per organization keeps tenants from starving each other
 * @param scheduledAt earliest run time
 * @param priority    1 is the most urgent
 */
public record InsertOpts(String queue, Instant scheduledAt, int priority) {
  public InsertOpts {
    Objects.requireNonNull(queue, "queue");
    if (queue.isBlank()) throw new IllegalArgumentException("queue is blank");
    scheduledAt = scheduledAt == null ? Instant.now() : scheduledAt;
    if (priority < 1) throw new IllegalArgumentException("priority must be >= 1: " + priority);
  }
}
