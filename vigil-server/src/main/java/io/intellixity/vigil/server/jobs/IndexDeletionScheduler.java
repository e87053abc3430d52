package io.intellixity.vigil.server.jobs;

import io.intellixity.vigil.lifecycle.jobs.IndexDeletionArgs;
import io.intellixity.vigil.spi.jobs.InsertOpts;
import io.intellixity.vigil.spi.jobs.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Queues the obsolete index sweep of every configured organization, on start and then periodically. */
public final class IndexDeletionScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IndexDeletionScheduler.class);

  static final int SWEEP_PRIORITY = 4;

  private final JobQueue queue;
  private final List<String> organizations;
  private final Duration interval;
  private final Clock clock;
  private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "vigil-index-deletion");
    t.setDaemon(true);
    return t;
  });

  public IndexDeletionScheduler(JobQueue queue, List<String> organizations, Duration interval, Clock clock) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.organizations = List.copyOf(organizations);
    this.interval = Objects.requireNonNull(interval, "interval");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (interval.isZero() || interval.isNegative()) throw new IllegalArgumentException("interval must be > 0");
  }

  public void start() {
    timer.scheduleAtFixedRate(this::enqueueAll, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  void enqueueAll() {
    for (String org : organizations) {
      try {
        queue.enqueue(new IndexDeletionArgs(org), new InsertOpts(org, Instant.now(clock), SWEEP_PRIORITY));
      } catch (RuntimeException e) {
        log.error("Could not queue index deletion sweep org={}", org, e);
      }
    }
  }

  @Override
  public void close() {
    timer.shutdownNow();
  }
}
