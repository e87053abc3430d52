package io.intellixity.vigil.advisor.coverage;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexFamily;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CoverageFilterTest {
  private final CoverageFilter filter = new CoverageFilter();

  @Test
  void coveredCandidateIsRemoved() {
    IndexFamily covered = IndexFamily.builder("t").flex("a").build();
    IndexFamily uncovered = IndexFamily.builder("t").flex("b").build();
    List<ConcreteIndex> existing = List.of(ConcreteIndex.aggregation("t", List.of("a", "b"), List.of()));

    assertEquals(List.of(uncovered), filter.retainUncovered(List.of(covered, uncovered), existing));
  }

  @Test
  void noExistingIndexKeepsEverything() {
    List<IndexFamily> candidates = List.of(IndexFamily.builder("t").flex("a").build());
    assertEquals(candidates, filter.retainUncovered(candidates, List.of()));
    assertFalse(CoverageFilter.isCovered(candidates.get(0), null));
  }

  @Test
  void indexOnAnotherTableDoesNotCover() {
    IndexFamily f = IndexFamily.builder("t").flex("a").build();
    assertFalse(CoverageFilter.isCovered(f, List.of(ConcreteIndex.aggregation("u", List.of("a"), List.of()))));
  }
}
