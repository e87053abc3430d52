package io.intellixity.vigil.server.jobs;

import io.intellixity.vigil.lifecycle.jobs.IndexDeletionArgs;
import io.intellixity.vigil.spi.jobs.InsertOpts;
import io.intellixity.vigil.spi.jobs.JobArgs;
import io.intellixity.vigil.spi.jobs.JobQueue;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class IndexDeletionSchedulerTest {
  private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

  static final class RecordingQueue implements JobQueue {
    final List<JobArgs> args = new ArrayList<>();
    final List<InsertOpts> opts = new ArrayList<>();
    String failFor;

    @Override
    public long enqueue(JobArgs a, InsertOpts o) {
      if (a.organizationId().equals(failFor)) throw new IllegalStateException("queue down");
      args.add(a);
      opts.add(o);
      return args.size();
    }
  }

  @Test
  void queuesOneSweepPerOrganizationOnItsOwnLane() {
    RecordingQueue queue = new RecordingQueue();
    IndexDeletionScheduler scheduler = new IndexDeletionScheduler(queue, List.of("org-a", "org-b"),
        Duration.ofMinutes(30), Clock.fixed(NOW, ZoneOffset.UTC));

    scheduler.enqueueAll();

    assertEquals(List.of(new IndexDeletionArgs("org-a"), new IndexDeletionArgs("org-b")), queue.args);
    assertEquals("org-a", queue.opts.get(0).queue());
    assertEquals(NOW, queue.opts.get(0).scheduledAt());
    assertEquals(IndexDeletionScheduler.SWEEP_PRIORITY, queue.opts.get(1).priority());
  }

  @Test
  void failureForOneOrganizationDoesNotSkipTheOthers() {
    RecordingQueue queue = new RecordingQueue();
    queue.failFor = "org-a";
    IndexDeletionScheduler scheduler = new IndexDeletionScheduler(queue, List.of("org-a", "org-b"),
        Duration.ofMinutes(30), Clock.fixed(NOW, ZoneOffset.UTC));

    scheduler.enqueueAll();

    assertEquals(List.of(new IndexDeletionArgs("org-b")), queue.args);
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new IndexDeletionScheduler(new RecordingQueue(), List.of(), Duration.ZERO, Clock.systemUTC()));
  }
}
