package io.intellixity.vigil.governance;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexType;
import io.intellixity.vigil.spi.catalog.CatalogHandle;
import io.intellixity.vigil.spi.catalog.IndexCatalog;
import io.intellixity.vigil.spi.scenario.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class GovernanceIndexCatalogResolverTest {

  private record TestHandle(String id, String namespace) implements CatalogHandle<Object> {
    @Override public Object client() { return new Object(); }
  }

  private static final class TestCatalog implements IndexCatalog {
    final CatalogHandle<?> handle;
    TestCatalog(CatalogHandle<?> handle) { this.handle = handle; }
    @Override public List<ConcreteIndex> listAllValidIndexes(IndexType... types) { return List.of(); }
    @Override public List<ConcreteIndex> listAllIndexes(IndexType... types) { return List.of(); }
    @Override public int countPendingIndexes() { return 0; }
    @Override public List<String> listIndicesPendingCreation() { return List.of(); }
    @Override public List<String> listInvalidIndices() { return List.of(); }
    @Override public void dropIndex(String indexName) { throw new UnsupportedOperationException(); }
    @Override public void createIndexesAsync(List<ConcreteIndex> indexes) { throw new UnsupportedOperationException(); }
  }

  private final AtomicInteger handleCalls = new AtomicInteger();
  private final AtomicInteger catalogCalls = new AtomicInteger();

  private GovernanceIndexCatalogResolver resolver(CatalogHandleResolver hr, int max, long ttl) {
    IndexCatalogFactory cf = handle -> {
      catalogCalls.incrementAndGet();
      return new TestCatalog(handle);
    };
    return new GovernanceIndexCatalogResolver(hr, cf, max, max, ttl);
  }

  private CatalogHandleResolver perOrganization() {
    return org -> {
      handleCalls.incrementAndGet();
      return new TestHandle(org + ":" + handleCalls.get(), "schema_" + org);
    };
  }

  @Test
  void cachesHandleAndCatalogByOrganization() {
    GovernanceIndexCatalogResolver r = resolver(perOrganization(), 10, 60_000);

    IndexCatalog c1 = r.forOrganization("org-1");
    IndexCatalog c2 = r.forOrganization(" org-1 ");

    assertSame(c1, c2);
    assertEquals(1, handleCalls.get());
    assertEquals(1, catalogCalls.get());
  }

  @Test
  void organizationsSharingADatabaseShareTheCatalog() {
    GovernanceIndexCatalogResolver r = resolver(org -> {
      handleCalls.incrementAndGet();
      return new TestHandle("shared-db", "public");
    }, 10, 60_000);

    assertSame(r.forOrganization("org-1"), r.forOrganization("org-2"));
    assertEquals(2, handleCalls.get());
    assertEquals(1, catalogCalls.get());
  }

  @Test
  void lruEvictionRecomputesAfterEvict() {
    GovernanceIndexCatalogResolver r = resolver(perOrganization(), 1, 60_000);

    IndexCatalog c1 = r.forOrganization("org-1");
    IndexCatalog c2 = r.forOrganization("org-2");
    assertNotSame(c1, c2);

    IndexCatalog c1b = r.forOrganization("org-1");
    assertNotSame(c1, c1b);
    assertEquals(3, handleCalls.get());
    assertEquals(3, catalogCalls.get());
  }

  @Test
  void ttlExpiryRecomputesAfterTtl() throws Exception {
    GovernanceIndexCatalogResolver r = resolver(perOrganization(), 10, 5);

    IndexCatalog c1 = r.forOrganization("org-1");
    Thread.sleep(10);
    IndexCatalog c2 = r.forOrganization("org-1");

    assertNotSame(c1, c2);
    assertTrue(handleCalls.get() >= 2);
  }

  @Test
  void unknownOrganizationIsNotFound() {
    GovernanceIndexCatalogResolver r = resolver(org -> null, 10, 60_000);
    assertThrows(NotFoundException.class, () -> r.forOrganization("org-x"));
    assertThrows(IllegalArgumentException.class, () -> r.forOrganization("  "));
  }

  @Test
  void currentResolvesTheBoundOrganization() {
    GovernanceIndexCatalogResolver r = resolver(perOrganization(), 10, 60_000);
    IndexCatalog c = Governance.inContext(GovernanceContext.forUser("org-7", "u", Role.VIEWER), r::current);
    assertEquals("schema_org-7", ((TestCatalog) c).handle.namespace());
    assertThrows(IllegalStateException.class, r::current);
  }
}
