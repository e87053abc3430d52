package io.intellixity.vigil.spi.jobs;

import java.time.Duration;
import java.util.Objects;

/** Outcome of one worker run: finished, or to be run again after a delay. */
public final class JobResult {
  private static final JobResult DONE = new JobResult(null);

  private final Duration snooze;

  private JobResult(Duration snooze) {
    this.snooze = snooze;
  }

  public static JobResult done() {
    return DONE;
  }

  /** Reschedule the same job; this does not count as a failed attempt. */
  public static JobResult snooze(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) throw new IllegalArgumentException("negative snooze: " + delay);
    return new JobResult(delay);
  }

  public boolean isSnoozed() {
    return snooze != null;
  }

  /** Snooze delay, or null when done. */
  public Duration snoozeDelay() {
    return snooze;
  }

  @Override
  public String toString() {
    return snooze == null ? "JobResult{done}" : "JobResult{snooze=" + snooze + "}";
  }
}
