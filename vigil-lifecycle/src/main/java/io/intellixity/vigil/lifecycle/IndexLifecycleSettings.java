package io.intellixity.vigil.lifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the index lifecycle.\n
 *
 * @param statusPollInterval delay between two checks of running index builds
 * @param resubmissionDelay  delay before a failed build is attempted again
 * @param creationPriority   queue priority of creation and status jobs
 * @param deletionInterval   period of the obsolete index sweep
 * @param deletionDryRun     when true the sweep only logs what it would drop
 */
public record IndexLifecycleSettings(Duration statusPollInterval,
                                     Duration resubmissionDelay,
                                     int creationPriority,
                                     Duration deletionInterval,
                                     boolean deletionDryRun) {
  public IndexLifecycleSettings {
    Objects.requireNonNull(statusPollInterval, "statusPollInterval");
    Objects.requireNonNull(resubmissionDelay, "resubmissionDelay");
    Objects.requireNonNull(deletionInterval, "deletionInterval");
    if (statusPollInterval.isNegative() || statusPollInterval.isZero()) {
      throw new IllegalArgumentException("statusPollInterval must be > 0");
    }
    if (resubmissionDelay.isNegative()) throw new IllegalArgumentException("resubmissionDelay must be >= 0");
    if (creationPriority < 1) throw new IllegalArgumentException("creationPriority must be >= 1");
  }

  public static IndexLifecycleSettings defaults() {
    return new IndexLifecycleSettings(Duration.ofSeconds(1), Duration.ofSeconds(30), 1, Duration.ofMinutes(30), true);
  }
}
