package io.intellixity.vigil.advisor.minimize;

import io.intellixity.vigil.advisor.model.IndexFamily;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class KeyOrdersTest {

  @Test
  void unconstrainedFlexIsSorted() {
    IndexFamily f = IndexFamily.builder("t").fixed("z").flex("c", "a", "b").last("y").build();
    assertEquals(Optional.of(List.of("z", "a", "b", "c", "y")), KeyOrders.solve(f, List.of(f)));
  }

  @Test
  void sourcesPinFlexPositions() {
    IndexFamily merged = IndexFamily.builder("t").flex("a", "b", "c").build();
    IndexFamily needsC = IndexFamily.builder("t").flex("c").build();
    IndexFamily needsCb = IndexFamily.builder("t").flex("c", "b").build();
    assertEquals(Optional.of(List.of("c", "b", "a")), KeyOrders.solve(merged, List.of(merged, needsC, needsCb)));
  }

  @Test
  void noOrderForConflictingPrefixes() {
    IndexFamily merged = IndexFamily.builder("t").flex("a", "b").build();
    List<IndexFamily> sources = List.of(
        IndexFamily.builder("t").flex("a").build(),
        IndexFamily.builder("t").flex("b").build());
    assertTrue(KeyOrders.solve(merged, sources).isEmpty());
  }

  @Test
  void includedOfSourceMustBeStored() {
    IndexFamily merged = IndexFamily.builder("t").flex("a").build();
    IndexFamily source = IndexFamily.builder("t").flex("a").included("amount").build();
    assertTrue(KeyOrders.solve(merged, List.of(source)).isEmpty());
  }

  @Test
  void sourceOnOtherTable() {
    IndexFamily merged = IndexFamily.builder("t").flex("a").build();
    assertTrue(KeyOrders.solve(merged, List.of(IndexFamily.builder("u").flex("a").build())).isEmpty());
  }
}
