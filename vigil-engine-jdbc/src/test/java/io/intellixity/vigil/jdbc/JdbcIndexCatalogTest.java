package io.intellixity.vigil.jdbc;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexStatus;
import io.intellixity.vigil.advisor.model.IndexType;
import io.intellixity.vigil.spi.catalog.IndexCatalogException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcIndexCatalogTest {

  private static Map<String, Object> row(String name, String table, String def, boolean valid, long relId) {
    return Map.of("indexname", name, "tablename", table, "indexdef", def, "indisvalid", valid, "indexrelid", relId);
  }

  private static FakeDatabase catalogRows() {
    return new FakeDatabase()
        .returning(TestIndexDialect.LIST, List.of(
            row("idx_transactions_a", "transactions", "account_id,created_at|amount", true, 11L),
            row("idx_transactions_b", "transactions", "account_id|", false, 12L),
            row("idx_transactions_c", "transactions", "counterparty|amount", false, 13L),
            row("nav_transactions_d", "transactions", "created_at|", true, 14L),
            row("transactions_pkey", "transactions", "id|", true, 15L)))
        .returning(TestIndexDialect.IN_CREATION, List.of(Map.of("index_relid", 13L)));
  }

  private static JdbcIndexCatalog catalog(FakeDatabase db, List<Runnable> tasks) {
    return new JdbcIndexCatalog(new JdbcHandle("org-1", db.dataSource(), "org_schema"),
        new TestIndexDialect(), tasks::add, Duration.ofMinutes(2));
  }

  @Test
  void listAllIndexesDerivesStatusAndType() {
    FakeDatabase db = catalogRows();
    List<ConcreteIndex> all = catalog(db, new ArrayList<>()).listAllIndexes();

    assertEquals(5, all.size());
    ConcreteIndex a = all.get(0);
    assertEquals("idx_transactions_a", a.name());
    assertEquals("transactions", a.tableName());
    assertEquals(List.of("account_id", "created_at"), a.indexed());
    assertEquals(List.of("amount"), a.included());
    assertEquals(IndexType.AGGREGATION, a.type());
    assertEquals(IndexStatus.VALID, a.status());

    assertEquals(IndexStatus.INVALID, all.get(1).status());
    assertEquals(IndexStatus.PENDING, all.get(2).status());
    assertEquals(IndexType.NAVIGATION, all.get(3).type());
    assertEquals(IndexType.UNKNOWN, all.get(4).type());

    assertTrue(db.binds.contains(List.of("org_schema")));
  }

  @Test
  void typeFilterAppliesToListings() {
    JdbcIndexCatalog c = catalog(catalogRows(), new ArrayList<>());

    assertEquals(3, c.listAllIndexes(IndexType.AGGREGATION).size());
    List<ConcreteIndex> valid = c.listAllValidIndexes(IndexType.AGGREGATION);
    assertEquals(1, valid.size());
    assertEquals("idx_transactions_a", valid.get(0).name());
    assertEquals(3, c.listAllValidIndexes().size());
  }

  @Test
  void countPendingCountsIndexesInCreation() {
    assertEquals(1, catalog(catalogRows(), new ArrayList<>()).countPendingIndexes());
  }

  @Test
  void pendingAndInvalidListingsReturnNames() {
    FakeDatabase db = new FakeDatabase()
        .returning(TestIndexDialect.PENDING, List.of(Map.of("indexname", "idx_t_x")))
        .returning(TestIndexDialect.INVALID, List.of(Map.of("indexname", "idx_t_y"), Map.of("indexname", "idx_t_z")));
    JdbcIndexCatalog c = catalog(db, new ArrayList<>());

    assertEquals(List.of("idx_t_x"), c.listIndicesPendingCreation());
    assertEquals(List.of("idx_t_y", "idx_t_z"), c.listInvalidIndices());
  }

  @Test
  void sqlErrorsAreWrapped() {
    FakeDatabase db = new FakeDatabase().failingOn(TestIndexDialect.INVALID);
    IndexCatalogException e = assertThrows(IndexCatalogException.class, () -> catalog(db, new ArrayList<>()).listInvalidIndices());
    assertNotNull(e.getCause());
    assertTrue(e.getMessage().contains("org-1"));
  }

  @Test
  void dropIndexRunsDdl() {
    FakeDatabase db = new FakeDatabase();
    catalog(db, new ArrayList<>()).dropIndex("idx_t_y");
    assertEquals(List.of("drop org_schema.idx_t_y"), db.executed);
    assertTrue(db.timeouts.isEmpty());
  }

  @Test
  void dropIndexRequiresName() {
    assertThrows(IllegalArgumentException.class, () -> catalog(new FakeDatabase(), new ArrayList<>()).dropIndex(" "));
  }

  @Test
  void createIndexesAsyncRunsSequentiallyInBackgroundAndContinuesAfterFailure() {
    FakeDatabase db = new FakeDatabase().failingOn("create org_schema.idx_t_1");
    List<Runnable> tasks = new ArrayList<>();
    JdbcIndexCatalog c = catalog(db, tasks);

    ConcreteIndex one = ConcreteIndex.aggregation("t", List.of("a"), List.of()).withName("idx_t_1");
    ConcreteIndex two = ConcreteIndex.aggregation("t", List.of("b"), List.of()).withName("idx_t_2");
    c.createIndexesAsync(List.of(one, two));

    assertTrue(db.executed.isEmpty());
    assertEquals(1, tasks.size());

    tasks.get(0).run();
    assertEquals(List.of("create org_schema.idx_t_1", "create org_schema.idx_t_2"), db.executed);
    assertEquals(List.of(120, 120), db.timeouts);
  }

  @Test
  void submittedBuildsArePendingUntilTheirStatementCompletes() {
    FakeDatabase db = new FakeDatabase().failingOn("create org_schema.idx_t_1");
    List<Runnable> tasks = new ArrayList<>();
    JdbcIndexCatalog c = catalog(db, tasks);
    List<List<String>> midBatch = new ArrayList<>();
    db.whenRunning("create org_schema.idx_t_2", () -> midBatch.add(c.listIndicesPendingCreation()));

    ConcreteIndex one = ConcreteIndex.aggregation("t", List.of("a"), List.of()).withName("idx_t_1");
    ConcreteIndex two = ConcreteIndex.aggregation("t", List.of("b"), List.of()).withName("idx_t_2");
    c.createIndexesAsync(List.of(one, two));

    assertEquals(List.of("idx_t_1", "idx_t_2"), c.listIndicesPendingCreation());
    assertEquals(2, c.countPendingIndexes());

    tasks.get(0).run();
    assertEquals(List.of(List.of("idx_t_2")), midBatch);
    assertEquals(List.of(), c.listIndicesPendingCreation());
    assertEquals(0, c.countPendingIndexes());
  }

  @Test
  void submittedBuildsAreSharedByCatalogsOverOneDatabase() {
    FakeDatabase db = new FakeDatabase()
        .returning(TestIndexDialect.PENDING, List.of(Map.of("indexname", "idx_t_1")));
    JdbcHandle handle = new JdbcHandle("org-1", db.dataSource(), "org_schema");
    SubmittedIndexBuilds builds = new SubmittedIndexBuilds();
    JdbcIndexCatalog creating = new JdbcIndexCatalog(handle, new TestIndexDialect(), r -> { }, Duration.ofMinutes(2), builds);
    JdbcIndexCatalog polling = new JdbcIndexCatalog(handle, new TestIndexDialect(), r -> { }, Duration.ofMinutes(2), builds);

    creating.createIndexesAsync(List.of(
        ConcreteIndex.aggregation("t", List.of("a"), List.of()).withName("idx_t_1"),
        ConcreteIndex.aggregation("t", List.of("b"), List.of()).withName("idx_t_2")));

    assertEquals(List.of("idx_t_1", "idx_t_2"), polling.listIndicesPendingCreation());
  }

  @Test
  void rejectedSubmissionIsNotLeftPending() {
    JdbcIndexCatalog c = new JdbcIndexCatalog(new JdbcHandle("org-1", new FakeDatabase().dataSource(), "org_schema"),
        new TestIndexDialect(), r -> { throw new RejectedExecutionException("shut down"); }, Duration.ofMinutes(2));

    ConcreteIndex one = ConcreteIndex.aggregation("t", List.of("a"), List.of()).withName("idx_t_1");
    assertThrows(RejectedExecutionException.class, () -> c.createIndexesAsync(List.of(one)));
    assertEquals(List.of(), c.listIndicesPendingCreation());
  }

  @Test
  void createIndexesAsyncRejectsUnnamedIndexes() {
    List<Runnable> tasks = new ArrayList<>();
    ConcreteIndex unnamed = ConcreteIndex.aggregation("t", List.of("a"), List.of());
    assertThrows(IllegalArgumentException.class, () -> catalog(new FakeDatabase(), tasks).createIndexesAsync(List.of(unnamed)));
    assertTrue(tasks.isEmpty());
  }

  @Test
  void createIndexesAsyncWithNothingSubmitsNothing() {
    List<Runnable> tasks = new ArrayList<>();
    catalog(new FakeDatabase(), tasks).createIndexesAsync(List.of());
    assertTrue(tasks.isEmpty());
  }

  @Test
  void handleDefaultsSchemaToPublic() {
    assertEquals("public", new JdbcHandle("h", new FakeDatabase().dataSource(), null).namespace());
  }
}
