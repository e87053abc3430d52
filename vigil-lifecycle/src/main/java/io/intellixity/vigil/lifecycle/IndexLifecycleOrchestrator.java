package io.intellixity.vigil.lifecycle;

import io.intellixity.vigil.advisor.IndexAdvisor;
import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexNames;
import io.intellixity.vigil.advisor.model.IndexType;
import io.intellixity.vigil.advisor.scenario.ScenarioAndIteration;
import io.intellixity.vigil.lifecycle.jobs.IndexCreationArgs;
import io.intellixity.vigil.spi.catalog.IndexCatalog;
import io.intellixity.vigil.spi.catalog.IndexCatalogProvider;
import io.intellixity.vigil.spi.jobs.InsertOpts;
import io.intellixity.vigil.spi.jobs.JobQueue;
import io.intellixity.vigil.spi.scenario.ScenarioFetcher;
import io.intellixity.vigil.spi.security.IndexSecurity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the index lifecycle: computes the indexes a scenario iteration needs and hands
 * their creation to the organization's job queue.\n
 *
 * Authorization is checked before any catalog or queue access.\n
 */
public final class IndexLifecycleOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(IndexLifecycleOrchestrator.class);

  private final ScenarioFetcher scenarios;
  private final IndexCatalogProvider catalogs;
  private final IndexSecurity security;
  private final JobQueue queue;
  private final IndexAdvisor advisor;
  private final IndexLifecycleSettings settings;
  private final Supplier<UUID> ids;
  private final Clock clock;

  public IndexLifecycleOrchestrator(ScenarioFetcher scenarios,
                                    IndexCatalogProvider catalogs,
                                    IndexSecurity security,
                                    JobQueue queue,
                                    IndexAdvisor advisor,
                                    IndexLifecycleSettings settings,
                                    Supplier<UUID> ids,
                                    Clock clock) {
    this.scenarios = Objects.requireNonNull(scenarios, "scenarios");
    this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
    this.security = Objects.requireNonNull(security, "security");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.advisor = Objects.requireNonNull(advisor, "advisor");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public IndexLifecycleOrchestrator(ScenarioFetcher scenarios,
                                    IndexCatalogProvider catalogs,
                                    IndexSecurity security,
                                    JobQueue queue,
                                    IndexLifecycleSettings settings) {
    this(scenarios, catalogs, security, queue, new IndexAdvisor(), settings, UUID::randomUUID, Clock.systemUTC());
  }

  public IndexesToCreate getIndexesToCreate(String organizationId, String iterationId) {
    ScenarioAndIteration si = scenarios.fetchScenarioAndIteration(iterationId);
    security.publishScenario(si.scenario());

    IndexCatalog catalog = catalogs.forOrganization(organizationId);
    List<ConcreteIndex> existing = catalog.listAllValidIndexes(IndexType.AGGREGATION);
    List<ConcreteIndex> toCreate = advisor.indexesToCreate(si.iteration(), existing);
    int numPending = catalog.countPendingIndexes();

    log.debug("vigil.lifecycle org={} iteration={} existing={} toCreate={} pending={}",
        organizationId, iterationId, existing.size(), toCreate.size(), numPending);
    return new IndexesToCreate(toCreate, numPending);
  }

  /**
   * Queue the creation of {@code indexes}; unnamed ones get a name first.\n
   *
   * @return the indexes as submitted, all named
   */
  public List<ConcreteIndex> createIndexesAsync(String organizationId, List<ConcreteIndex> indexes) {
    Objects.requireNonNull(indexes, "indexes");
    security.writeDataModelIndexes(organizationId);
    if (indexes.isEmpty()) return List.of();

    List<ConcreteIndex> named = new ArrayList<>(indexes.size());
    for (ConcreteIndex i : indexes) named.add(IndexNames.ensureNamed(i, ids));

    queue.enqueue(new IndexCreationArgs(organizationId, named, false),
        new InsertOpts(organizationId, Instant.now(clock), settings.creationPriority()));
    log.info("{} indexes pending creation org={} indexes={}", named.size(), organizationId, names(named));
    return List.copyOf(named);
  }

  /** Catalog listing for the index endpoint; all indexes or only the valid ones. */
  public List<ConcreteIndex> listIndexes(String organizationId, boolean validOnly) {
    security.readDataModel(organizationId);
    IndexCatalog catalog = catalogs.forOrganization(organizationId);
    return validOnly ? catalog.listAllValidIndexes() : catalog.listAllIndexes();
  }

  static List<String> names(List<ConcreteIndex> indexes) {
    List<String> out = new ArrayList<>(indexes.size());
    for (ConcreteIndex i : indexes) out.add(i.name());
    return out;
  }
}
