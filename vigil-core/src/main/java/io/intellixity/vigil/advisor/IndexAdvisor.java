package io.intellixity.vigil.advisor;

import io.intellixity.vigil.advisor.ast.AstNode;
import io.intellixity.vigil.advisor.coverage.CoverageFilter;
import io.intellixity.vigil.advisor.extract.QueryPatternExtractor;
import io.intellixity.vigil.advisor.family.IndexFamilyGenerator;
import io.intellixity.vigil.advisor.minimize.FamilyMinimizer;
import io.intellixity.vigil.advisor.minimize.MinimizedFamily;
import io.intellixity.vigil.advisor.model.AggregateQueryFamily;
import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexFamily;
import io.intellixity.vigil.advisor.project.ConcreteIndexProjector;
import io.intellixity.vigil.advisor.scenario.ScenarioIteration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Pure index advisor pipeline: extract query families from rule expressions, expand them into
 * index families, drop what existing indexes already serve, minimize the rest and project the
 * result to unnamed aggregation indexes.\n
 *
 * Deterministic: the same inputs always give the same indexes in the same order.\n
 */
public final class IndexAdvisor {
  private static final Logger log = LoggerFactory.getLogger(IndexAdvisor.class);

  private final QueryPatternExtractor extractor;
  private final IndexFamilyGenerator generator;
  private final CoverageFilter coverage;
  private final FamilyMinimizer minimizer;
  private final ConcreteIndexProjector projector;

  public IndexAdvisor() {
    this(new QueryPatternExtractor(), new IndexFamilyGenerator(), new CoverageFilter(),
        new FamilyMinimizer(), new ConcreteIndexProjector());
  }

  public IndexAdvisor(QueryPatternExtractor extractor,
                      IndexFamilyGenerator generator,
                      CoverageFilter coverage,
                      FamilyMinimizer minimizer,
                      ConcreteIndexProjector projector) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.coverage = Objects.requireNonNull(coverage, "coverage");
    this.minimizer = Objects.requireNonNull(minimizer, "minimizer");
    this.projector = Objects.requireNonNull(projector, "projector");
  }

  public List<ConcreteIndex> indexesToCreate(ScenarioIteration iteration, Collection<ConcreteIndex> existing) {
    return indexesToCreate(List.of(iteration), existing);
  }

  public List<ConcreteIndex> indexesToCreate(Collection<ScenarioIteration> iterations,
                                             Collection<ConcreteIndex> existing) {
    List<AstNode> expressions = new ArrayList<>();
    for (ScenarioIteration it : iterations) expressions.addAll(it.expressions());
    return indexesToCreateForExpressions(expressions, existing);
  }

  public List<ConcreteIndex> indexesToCreateForExpressions(Collection<AstNode> expressions,
                                                          Collection<ConcreteIndex> existing) {
    return indexesToCreateForQueries(extractor.extract(expressions), existing);
  }

  public List<ConcreteIndex> indexesToCreateForQueries(Collection<AggregateQueryFamily> queries,
                                                       Collection<ConcreteIndex> existing) {
    Collection<ConcreteIndex> current = existing == null ? List.of() : existing;
    SortedSet<IndexFamily> candidates = candidateFamiliesOf(queries);
    List<IndexFamily> uncovered = coverage.retainUncovered(candidates, current);
    List<MinimizedFamily> minimized = minimizer.minimize(uncovered);

    List<ConcreteIndex> out = projector.project(minimized);
    log.debug("vigil.advisor queries={} candidates={} uncovered={} indexes={}",
        queries.size(), candidates.size(), uncovered.size(), out.size());
    return out;
  }

  /** Every index family a set of rule expressions needs, before coverage and minimization. */
  public SortedSet<IndexFamily> candidateFamilies(Collection<AstNode> expressions) {
    return candidateFamiliesOf(extractor.extract(expressions));
  }

  private SortedSet<IndexFamily> candidateFamiliesOf(Collection<AggregateQueryFamily> queries) {
    SortedSet<IndexFamily> out = new TreeSet<>();
    for (AggregateQueryFamily q : queries) out.addAll(generator.generate(q));
    return out;
  }
}
