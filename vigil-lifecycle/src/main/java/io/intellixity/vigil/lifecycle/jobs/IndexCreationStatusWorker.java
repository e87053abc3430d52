package io.intellixity.vigil.lifecycle.jobs;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexNames;
import io.intellixity.vigil.advisor.model.Identifiers;
import io.intellixity.vigil.lifecycle.IndexLifecycleSettings;
import io.intellixity.vigil.spi.catalog.IndexCatalog;
import io.intellixity.vigil.spi.catalog.IndexCatalogException;
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
import java.util.*;
import java.util.function.Supplier;

/**
 * Watches a batch of index builds until it settles.\n
 *
 * While any build is running the job snoozes. Indexes that are then missing from the valid ones
 * are resubmitted once under a fresh name, after their invalid leftover is dropped; a second
 * failure is only logged.\n
 */
public final class IndexCreationStatusWorker implements JobWorker<IndexCreationStatusArgs> {
  private static final Logger log = LoggerFactory.getLogger(IndexCreationStatusWorker.class);

  private final IndexCatalogProvider catalogs;
  private final JobQueue queue;
  private final IndexLifecycleSettings settings;
  private final Supplier<UUID> ids;
  private final Clock clock;

  public IndexCreationStatusWorker(IndexCatalogProvider catalogs,
                                   JobQueue queue,
                                   IndexLifecycleSettings settings,
                                   Supplier<UUID> ids,
                                   Clock clock) {
    this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override public String kind() { return IndexCreationStatusArgs.KIND; }
  @Override public Class<IndexCreationStatusArgs> argsType() { return IndexCreationStatusArgs.class; }

  @Override
  public JobResult work(Job<IndexCreationStatusArgs> job) {
    IndexCreationStatusArgs args = job.args();
    String org = args.organizationId();
    IndexCatalog catalog = catalogs.forOrganization(org);

    List<String> pending = catalog.listIndicesPendingCreation();
    if (!pending.isEmpty()) {
      log.debug("vigil.jobs index creation still ongoing org={} pending={}", org, pending);
      return JobResult.snooze(settings.statusPollInterval());
    }

    List<ConcreteIndex> missing = missing(args.indexes(), catalog.listAllValidIndexes());
    if (missing.isEmpty()) {
      log.info("Finished creating {} indexes org={}", args.indexes().size(), org);
      return JobResult.done();
    }

    if (args.resubmission()) {
      log.error("Index creation failed after resubmission org={} indexes={}", org, names(missing));
      return JobResult.done();
    }

    dropInvalidLeftovers(catalog, org, missing);

    List<ConcreteIndex> renamed = new ArrayList<>(missing.size());
    for (ConcreteIndex i : missing) renamed.add(IndexNames.rename(i, ids));
    queue.enqueue(new IndexCreationArgs(org, renamed, true),
        new InsertOpts(org, Instant.now(clock).plus(settings.resubmissionDelay()), settings.creationPriority()));
    log.warn("Index creation failed, resubmitting org={} failed={} resubmitted={}", org, names(missing), names(renamed));
    return JobResult.done();
  }

  private static List<ConcreteIndex> missing(List<ConcreteIndex> requested, List<ConcreteIndex> valid) {
    List<ConcreteIndex> out = new ArrayList<>();
    for (ConcreteIndex r : requested) {
      boolean found = false;
      for (ConcreteIndex v : valid) {
        if (Objects.equals(r.name(), v.name()) && Identifiers.same(r.tableName(), v.tableName())) {
          found = true;
          break;
        }
      }
      if (!found) out.add(r);
    }
    return out;
  }

  private static void dropInvalidLeftovers(IndexCatalog catalog, String org, List<ConcreteIndex> missing) {
    Set<String> invalid = new HashSet<>(catalog.listInvalidIndices());
    for (ConcreteIndex i : missing) {
      if (!invalid.contains(i.name())) continue;
      try {
        catalog.dropIndex(i.name());
        log.info("Dropped invalid index org={} index={}", org, i.name());
      } catch (IndexCatalogException e) {
        log.warn("Could not drop invalid index org={} index={}", org, i.name(), e);
      }
    }
  }

  private static List<String> names(List<ConcreteIndex> indexes) {
    List<String> out = new ArrayList<>(indexes.size());
    for (ConcreteIndex i : indexes) out.add(i.name());
    return out;
  }
}
