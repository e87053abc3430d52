package io.intellixity.vigil.lifecycle.jobs;

import io.intellixity.vigil.lifecycle.IndexLifecycleSettings;
import io.intellixity.vigil.spi.catalog.IndexCatalogProvider;
import io.intellixity.vigil.spi.jobs.InsertOpts;
import io.intellixity.vigil.spi.jobs.Job;
import io.intellixity.vigil.spi.jobs.JobQueue;
import io.intellixity.vigil.spi.jobs.JobResult;
import io.intellixity.vigil.spi.jobs.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Starts the background builds, then queues the status check.\n
 *
 * The check runs one poll interval later so that it does not observe the batch before the first
 * build has started.\n
 */
public final class IndexCreationWorker implements JobWorker<IndexCreationArgs> {
  private static final Logger log = LoggerFactory.getLogger(IndexCreationWorker.class);

  private final IndexCatalogProvider catalogs;
  private final JobQueue queue;
  private final IndexLifecycleSettings settings;
  private final Clock clock;

  public IndexCreationWorker(IndexCatalogProvider catalogs, JobQueue queue, IndexLifecycleSettings settings, Clock clock) {
    this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override public String kind() { return IndexCreationArgs.KIND; }
  @Override public Class<IndexCreationArgs> argsType() { return IndexCreationArgs.class; }

  @Override
  public JobResult work(Job<IndexCreationArgs> job) {
    IndexCreationArgs args = job.args();
    log.debug("vigil.jobs creating indexes org={} count={} resubmission={}",
        args.organizationId(), args.indexes().size(), args.resubmission());
    if (args.indexes().isEmpty()) return JobResult.done();

    catalogs.forOrganization(args.organizationId()).createIndexesAsync(args.indexes());

    Instant checkAt = Instant.now(clock).plus(settings.statusPollInterval());
    queue.enqueue(new IndexCreationStatusArgs(args.organizationId(), args.indexes(), args.resubmission()),
        new InsertOpts(args.organizationId(), checkAt, settings.creationPriority()));
    return JobResult.done();
  }
}
