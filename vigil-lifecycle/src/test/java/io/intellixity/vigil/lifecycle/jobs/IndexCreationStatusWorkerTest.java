package io.intellixity.vigil.lifecycle.jobs;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.lifecycle.IndexLifecycleSettings;
import io.intellixity.vigil.spi.jobs.InsertOpts;
import io.intellixity.vigil.spi.jobs.Job;
import io.intellixity.vigil.spi.jobs.JobResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.intellixity.vigil.lifecycle.LifecycleFakes.*;
import static org.junit.jupiter.api.Assertions.*;

final class IndexCreationStatusWorkerTest {
  private final FakeCatalogs catalogs = new FakeCatalogs();
  private final RecordingQueue queue = new RecordingQueue();
  private final IndexCreationStatusWorker worker = new IndexCreationStatusWorker(
      catalogs, queue, IndexLifecycleSettings.defaults(), sequentialIds(), CLOCK);

  private final ConcreteIndex a = index("idx_transactions_a", "transactions", List.of("account_id"), List.of("amount"));
  private final ConcreteIndex b = index("idx_transactions_b", "transactions", List.of("counterparty"), List.of());

  private JobResult run(boolean resubmission) {
    return worker.work(new Job<>(7, new IndexCreationStatusArgs("org-1", List.of(a, b), resubmission), 1, NOW));
  }

  @Test
  void snoozesWhileBuildsAreRunning() {
    catalogs.catalog.pending.add("idx_transactions_b");

    JobResult r = run(false);

    assertTrue(r.isSnoozed());
    assertEquals(Duration.ofSeconds(1), r.snoozeDelay());
    assertTrue(catalogs.catalog.validListings.isEmpty());
    assertTrue(queue.jobs.isEmpty());
  }

  @Test
  void statusCheckBetweenQueuedBuildsWaitsForTheRestOfTheBatch() {
    IndexCreationWorker creation = new IndexCreationWorker(catalogs, queue, IndexLifecycleSettings.defaults(), CLOCK);
    creation.work(new Job<>(6, new IndexCreationArgs("org-1", List.of(a, b), false), 1, NOW));
    assertEquals(1, queue.jobs.size());

    catalogs.catalog.finishNextBuild(true);
    JobResult midBatch = run(false);

    assertTrue(midBatch.isSnoozed());
    assertEquals(1, queue.jobs.size());
    assertTrue(catalogs.catalog.dropped.isEmpty());
    assertEquals(1, catalogs.catalog.created.size());

    catalogs.catalog.finishNextBuild(true);
    JobResult finished = run(false);

    assertFalse(finished.isSnoozed());
    assertEquals(1, queue.jobs.size());
  }

  @Test
  void doneWhenEveryIndexIsValid() {
    catalogs.catalog.indexes.add(a);
    catalogs.catalog.indexes.add(b.withName("idx_transactions_b"));

    JobResult r = run(false);

    assertFalse(r.isSnoozed());
    assertTrue(queue.jobs.isEmpty());
    assertTrue(catalogs.catalog.dropped.isEmpty());
  }

  @Test
  void sameNameOnAnotherTableDoesNotCount() {
    catalogs.catalog.indexes.add(a);
    catalogs.catalog.indexes.add(index("idx_transactions_b", "accounts", List.of("counterparty"), List.of()));

    run(false);

    assertEquals(1, queue.jobs.size());
  }

  @Test
  void missingIndexesAreResubmittedOnceUnderAFreshName() {
    catalogs.catalog.indexes.add(a);
    catalogs.catalog.invalid.add("idx_transactions_b");
    catalogs.catalog.invalid.add("idx_unrelated");

    JobResult r = run(false);

    assertFalse(r.isSnoozed());
    assertEquals(List.of("idx_transactions_b"), catalogs.catalog.dropped);
    assertEquals(1, queue.jobs.size());

    IndexCreationArgs resubmitted = (IndexCreationArgs) queue.jobs.get(0).args();
    assertTrue(resubmitted.resubmission());
    assertEquals(1, resubmitted.indexes().size());
    ConcreteIndex renamed = resubmitted.indexes().get(0);
    assertEquals(b, renamed);
    assertNotEquals(b.name(), renamed.name());
    assertTrue(renamed.name().startsWith("idx_transactions_counterparty_"));
    assertEquals(new InsertOpts("org-1", NOW.plusSeconds(30), 1), queue.jobs.get(0).opts());
  }

  @Test
  void failedDropDoesNotPreventTheResubmission() {
    catalogs.catalog.invalid.add("idx_transactions_a");
    catalogs.catalog.failingDrops.add("idx_transactions_a");

    run(false);

    assertEquals(2, ((IndexCreationArgs) queue.jobs.get(0).args()).indexes().size());
  }

  @Test
  void secondFailureIsOnlyReported() {
    catalogs.catalog.invalid.add("idx_transactions_b");

    JobResult r = run(true);

    assertFalse(r.isSnoozed());
    assertTrue(queue.jobs.isEmpty());
    assertTrue(catalogs.catalog.dropped.isEmpty());
  }
}
