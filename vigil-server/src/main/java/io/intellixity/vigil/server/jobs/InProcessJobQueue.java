package io.intellixity.vigil.server.jobs;

import io.intellixity.vigil.governance.Governance;
import io.intellixity.vigil.governance.GovernanceContext;
import io.intellixity.vigil.spi.jobs.InsertOpts;
import io.intellixity.vigil.spi.jobs.Job;
import io.intellixity.vigil.spi.jobs.JobArgs;
import io.intellixity.vigil.spi.jobs.JobQueue;
import io.intellixity.vigil.spi.jobs.JobResult;
import io.intellixity.vigil.spi.jobs.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link JobQueue} running jobs in this process.\n
 *
 * Each queue name is a lane backed by its own single-threaded scheduler, created on first use, so a
 * slow organization never delays another one. Within a lane jobs run in scheduled-time order.
 * Snoozed jobs are rescheduled on their lane; failed ones are retried with exponential backoff
 * until {@link RetryPolicy#maxAttempts()}.\n
 *
 * Workers run inside a system {@link GovernanceContext} bound to the job's organization.\n
 */
public final class InProcessJobQueue implements JobQueue, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(InProcessJobQueue.class);

  public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    public RetryPolicy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      Objects.requireNonNull(initialBackoff, "initialBackoff");
      Objects.requireNonNull(maxBackoff, "maxBackoff");
    }

    /** Delay before attempt {@code failedAttempt + 1}. */
    public Duration backoff(int failedAttempt) {
      Duration d = initialBackoff;
      for (int i = 1; i < failedAttempt && d.compareTo(maxBackoff) < 0; i++) d = d.multipliedBy(2);
      return d.compareTo(maxBackoff) > 0 ? maxBackoff : d;
    }
  }

  /** A worker with its args type, so a queued job is handed over through a checked cast. */
  private static final class Registration<A extends JobArgs> {
    private final JobWorker<A> worker;
    private final Class<A> argsType;

    private Registration(JobWorker<A> worker) {
      this.worker = worker;
      this.argsType = Objects.requireNonNull(worker.argsType(), "argsType");
    }

    private static <A extends JobArgs> Registration<A> of(JobWorker<A> worker) {
      return new Registration<>(worker);
    }

    private JobResult work(Job<JobArgs> job) {
      return worker.work(new Job<>(job.id(), argsType.cast(job.args()), job.attempt(), job.scheduledAt()));
    }
  }

  private final Map<String, Registration<?>> workers = new ConcurrentHashMap<>();
  private final Map<String, ScheduledExecutorService> lanes = new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();
  private final RetryPolicy retry;
  private final Clock clock;
  private volatile boolean closed;

  public InProcessJobQueue(RetryPolicy retry, Clock clock) {
    this.retry = Objects.requireNonNull(retry, "retry");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public InProcessJobQueue register(JobWorker<?> worker) {
    Objects.requireNonNull(worker, "worker");
    Registration<?> prev = workers.putIfAbsent(worker.kind(), Registration.of(worker));
    if (prev != null && prev.worker != worker) throw new IllegalStateException("Worker already registered for kind " + worker.kind());
    return this;
  }

  @Override
  public long enqueue(JobArgs args, InsertOpts opts) {
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(opts, "opts");
    Registration<?> worker = workers.get(args.kind());
    if (worker == null) throw new IllegalArgumentException("No worker registered for kind " + args.kind());
    if (!worker.argsType.isInstance(args)) {
      throw new IllegalArgumentException("Worker " + args.kind() + " expects " + worker.argsType.getName());
    }
    if (closed) throw new IllegalStateException("Job queue is closed");

    long id = ids.incrementAndGet();
    log.debug("vigil.jobs enqueue id={} kind={} queue={} priority={} scheduledAt={}",
        id, args.kind(), opts.queue(), opts.priority(), opts.scheduledAt());
    schedule(opts.queue(), new Job<>(id, args, 1, opts.scheduledAt()));
    return id;
  }

  private void schedule(String queue, Job<JobArgs> job) {
    long delayMillis = Math.max(0, Duration.between(Instant.now(clock), job.scheduledAt()).toMillis());
    try {
      lane(queue).schedule(() -> run(queue, job), delayMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.warn("vigil.jobs dropped id={} kind={} queue={}: queue closed", job.id(), job.args().kind(), queue);
    }
  }

  private ScheduledExecutorService lane(String queue) {
    return lanes.computeIfAbsent(queue, q -> Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "vigil-jobs-" + q);
      t.setDaemon(true);
      return t;
    }));
  }

  private void run(String queue, Job<JobArgs> job) {
    Registration<?> worker = workers.get(job.args().kind());
    String org = job.args().organizationId();
    GovernanceContext system = GovernanceContext.of(Map.of(GovernanceContext.ORG_ID, org), "job:" + org);
    long start = System.nanoTime();
    try {
      JobResult result = Governance.inContext(system, () -> worker.work(job));
      if (result.isSnoozed()) {
        Instant at = Instant.now(clock).plus(result.snoozeDelay());
        log.debug("vigil.jobs snoozed id={} kind={} queue={} until={}", job.id(), job.args().kind(), queue, at);
        schedule(queue, new Job<>(job.id(), job.args(), job.attempt(), at));
        return;
      }
      log.debug("vigil.jobs_done id={} kind={} queue={} attempt={} durationMs={}",
          job.id(), job.args().kind(), queue, job.attempt(), (System.nanoTime() - start) / 1_000_000.0);
    } catch (RuntimeException e) {
      if (job.attempt() >= retry.maxAttempts()) {
        log.error("vigil.jobs discarded id={} kind={} queue={} after {} attempts",
            job.id(), job.args().kind(), queue, job.attempt(), e);
        return;
      }
      Instant at = Instant.now(clock).plus(retry.backoff(job.attempt()));
      log.warn("vigil.jobs failed id={} kind={} queue={} attempt={}, retrying at {}",
          job.id(), job.args().kind(), queue, job.attempt(), at, e);
      schedule(queue, new Job<>(job.id(), job.args(), job.attempt() + 1, at));
    }
  }

  @Override
  public void close() {
    closed = true;
    for (ScheduledExecutorService lane : lanes.values()) lane.shutdownNow();
  }
}
