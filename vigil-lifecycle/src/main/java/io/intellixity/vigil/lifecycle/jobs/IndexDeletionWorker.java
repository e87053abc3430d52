package io.intellixity.vigil.lifecycle.jobs;

import io.intellixity.vigil.advisor.IndexAdvisor;
import io.intellixity.vigil.advisor.ast.AstNode;
import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexFamily;
import io.intellixity.vigil.advisor.model.IndexType;
import io.intellixity.vigil.advisor.scenario.ScenarioIteration;
import io.intellixity.vigil.lifecycle.IndexLifecycleSettings;
import io.intellixity.vigil.spi.catalog.IndexCatalog;
import io.intellixity.vigil.spi.catalog.IndexCatalogException;
import io.intellixity.vigil.spi.catalog.IndexCatalogProvider;
import io.intellixity.vigil.spi.jobs.Job;
import io.intellixity.vigil.spi.jobs.JobResult;
import io.intellixity.vigil.spi.jobs.JobWorker;
import io.intellixity.vigil.spi.scenario.ScenarioFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Periodic sweep of advisor indexes no live iteration needs any more.\n
 *
 * An index is kept when it serves at least one candidate family of the live iterations and no other
 * kept index makes it redundant. Other {@code idx_} indexes are deletion candidates; in dry-run mode
 * they are only logged.\n
 */
public final class IndexDeletionWorker implements JobWorker<IndexDeletionArgs> {
  private static final Logger log = LoggerFactory.getLogger(IndexDeletionWorker.class);

  private final IndexCatalogProvider catalogs;
  private final ScenarioFetcher scenarios;
  private final IndexAdvisor advisor;
  private final IndexLifecycleSettings settings;

  public IndexDeletionWorker(IndexCatalogProvider catalogs,
                             ScenarioFetcher scenarios,
                             IndexAdvisor advisor,
                             IndexLifecycleSettings settings) {
    this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
    this.scenarios = Objects.requireNonNull(scenarios, "scenarios");
    this.advisor = Objects.requireNonNull(advisor, "advisor");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override public String kind() { return IndexDeletionArgs.KIND; }
  @Override public Class<IndexDeletionArgs> argsType() { return IndexDeletionArgs.class; }

  @Override
  public JobResult work(Job<IndexDeletionArgs> job) {
    String org = job.args().organizationId();
    IndexCatalog catalog = catalogs.forOrganization(org);
    List<ConcreteIndex> valid = catalog.listAllValidIndexes();

    List<AstNode> expressions = new ArrayList<>();
    for (ScenarioIteration it : scenarios.listLiveIterations(org)) expressions.addAll(it.expressions());
    Set<IndexFamily> required = advisor.candidateFamilies(expressions);

    List<ConcreteIndex> keep = withoutRedundant(serving(valid, required));
    Set<String> keepNames = new HashSet<>();
    for (ConcreteIndex k : keep) keepNames.add(k.name());

    Map<String, RuntimeException> failures = new LinkedHashMap<>();
    for (ConcreteIndex index : deletionCandidates(valid, keepNames)) {
      log.info("Index {}.{} is candidate for deletion org={} dryRun={}",
          index.tableName(), index.name(), org, settings.deletionDryRun());
      if (settings.deletionDryRun()) continue;
      try {
        catalog.dropIndex(index.name());
        log.info("Index {}.{} deleted org={}", index.tableName(), index.name(), org);
      } catch (IndexCatalogException e) {
        failures.put(index.name(), e);
      }
    }

    if (!failures.isEmpty()) {
      IllegalStateException e = new IllegalStateException("Could not delete obsolete indexes " + failures.keySet() + " org=" + org);
      failures.values().forEach(e::addSuppressed);
      throw e;
    }
    return JobResult.done();
  }

  static List<ConcreteIndex> serving(List<ConcreteIndex> valid, Collection<IndexFamily> required) {
    List<ConcreteIndex> out = new ArrayList<>();
    for (ConcreteIndex index : valid) {
      for (IndexFamily f : required) {
        if (index.covers(f)) {
          out.add(index);
          break;
        }
      }
    }
    return out;
  }

  /**
   * Drop indexes another one subsumes. Of two structurally equal indexes the one with the smaller
   * name stays.\n
   */
  static List<ConcreteIndex> withoutRedundant(List<ConcreteIndex> serving) {
    List<ConcreteIndex> out = new ArrayList<>();
    for (ConcreteIndex lhs : serving) {
      boolean redundant = false;
      for (ConcreteIndex rhs : serving) {
        if (lhs == rhs || Objects.equals(lhs.name(), rhs.name())) continue;
        if (!lhs.isSubsumedBy(rhs)) continue;
        if (!rhs.isSubsumedBy(lhs) || rhs.name().compareTo(lhs.name()) < 0) {
          redundant = true;
          break;
        }
      }
      if (!redundant) out.add(lhs);
    }
    return out;
  }

  static List<ConcreteIndex> deletionCandidates(List<ConcreteIndex> valid, Set<String> keepNames) {
    List<ConcreteIndex> out = new ArrayList<>();
    for (ConcreteIndex index : valid) {
      if (index.type() != IndexType.AGGREGATION) continue;
      if (index.name().endsWith("_pkey")) continue;
      if (keepNames.contains(index.name())) continue;
      out.add(index);
    }
    return out;
  }
}
