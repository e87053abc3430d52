package io.intellixity.vigil.jdbc;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexStatus;
import io.intellixity.vigil.advisor.model.IndexType;
import io.intellixity.vigil.jdbc.dialect.IndexDefinition;
import io.intellixity.vigil.jdbc.dialect.IndexDialect;
import io.intellixity.vigil.spi.catalog.IndexCatalog;
import io.intellixity.vigil.spi.catalog.IndexCatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.Executor;

/**
 * {@link IndexCatalog} over a JDBC client database.\n
 *
 * Index builds are submitted to {@code ddlExecutor} as one task that creates the indexes in order;
 * a failed build is logged and the next one is attempted. Until its statement completes, every
 * submitted index counts as pending.\n
 */
public final class JdbcIndexCatalog implements IndexCatalog {
  private static final Logger log = LoggerFactory.getLogger(JdbcIndexCatalog.class);

  public static final Duration DEFAULT_CREATE_TIMEOUT = Duration.ofHours(4);

  @FunctionalInterface
  interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private final JdbcHandle handle;
  private final IndexDialect dialect;
  private final Executor ddlExecutor;
  private final Duration createTimeout;
  private final SubmittedIndexBuilds submitted;
  private final DataSource ds;

  public JdbcIndexCatalog(JdbcHandle handle, IndexDialect dialect, Executor ddlExecutor, Duration createTimeout,
                          SubmittedIndexBuilds submitted) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.ddlExecutor = Objects.requireNonNull(ddlExecutor, "ddlExecutor");
    this.createTimeout = createTimeout == null ? DEFAULT_CREATE_TIMEOUT : createTimeout;
    this.submitted = Objects.requireNonNull(submitted, "submitted");
    this.ds = handle.client();
  }

  public JdbcIndexCatalog(JdbcHandle handle, IndexDialect dialect, Executor ddlExecutor, Duration createTimeout) {
    this(handle, dialect, ddlExecutor, createTimeout, new SubmittedIndexBuilds());
  }

  public JdbcIndexCatalog(JdbcHandle handle, IndexDialect dialect, Executor ddlExecutor) {
    this(handle, dialect, ddlExecutor, DEFAULT_CREATE_TIMEOUT);
  }

  public JdbcHandle handle() { return handle; }

  @Override
  public List<ConcreteIndex> listAllValidIndexes(IndexType... types) {
    List<ConcreteIndex> out = new ArrayList<>();
    for (ConcreteIndex i : listAllIndexes(types)) {
      if (i.status() == IndexStatus.VALID) out.add(i);
    }
    return out;
  }

  @Override
  public List<ConcreteIndex> listAllIndexes(IndexType... types) {
    Set<IndexType> wanted = (types == null || types.length == 0) ? EnumSet.allOf(IndexType.class) : EnumSet.copyOf(Arrays.asList(types));
    Set<Long> inCreation = new HashSet<>(query("LIST_IN_CREATION", dialect.listIndexesInCreation(), rs -> rs.getLong("index_relid")));

    List<ConcreteIndex> out = new ArrayList<>();
    for (CatalogRow row : query("LIST_INDEXES", dialect.listIndexes(handle.schema()), CatalogRow::read)) {
      IndexType type = IndexType.fromIndexName(row.indexName);
      if (!wanted.contains(type)) continue;
      IndexStatus status;
      if (inCreation.contains(row.relId)) status = IndexStatus.PENDING;
      else status = row.valid ? IndexStatus.VALID : IndexStatus.INVALID;
      IndexDefinition def = dialect.parseIndexDefinition(row.definition);
      out.add(new ConcreteIndex(row.tableName, row.indexName, def.indexed(), def.included(), type, status));
    }
    return out;
  }

  @Override
  public int countPendingIndexes() {
    Set<String> pending = new HashSet<>(submitted.names());
    for (ConcreteIndex i : listAllIndexes()) {
      if (i.status() == IndexStatus.PENDING) pending.add(i.name());
    }
    return pending.size();
  }

  @Override
  public List<String> listIndicesPendingCreation() {
    List<String> out = query("LIST_PENDING", dialect.listPendingCreation(handle.schema()), rs -> rs.getString("indexname"));
    for (String name : submitted.names()) {
      if (!out.contains(name)) out.add(name);
    }
    return out;
  }

  @Override
  public List<String> listInvalidIndices() {
    return query("LIST_INVALID", dialect.listInvalidIndexes(handle.schema()), rs -> rs.getString("indexname"));
  }

  @Override
  public void dropIndex(String indexName) {
    if (indexName == null || indexName.isBlank()) throw new IllegalArgumentException("indexName is required");
    execute("DROP_INDEX", dialect.dropIndex(handle.schema(), indexName), Duration.ZERO);
  }

  @Override
  public void createIndexesAsync(List<ConcreteIndex> indexes) {
    Objects.requireNonNull(indexes, "indexes");
    for (ConcreteIndex i : indexes) {
      if (i.name() == null) throw new IllegalArgumentException("Index must be named before creation: " + i);
    }
    if (indexes.isEmpty()) return;
    List<ConcreteIndex> batch = List.copyOf(indexes);
    submitted.submitted(batch);
    try {
      ddlExecutor.execute(() -> createAll(batch));
    } catch (RuntimeException e) {
      for (ConcreteIndex i : batch) submitted.finished(i.name());
      throw e;
    }
  }

  private void createAll(List<ConcreteIndex> batch) {
    for (ConcreteIndex index : batch) {
      try {
        execute("CREATE_INDEX", dialect.createIndex(handle.schema(), index), createTimeout);
        log.info("vigil.jdbc index created handleId={} schema={} index={}", handle.id(), handle.schema(), index.name());
      } catch (RuntimeException e) {
        log.error("vigil.jdbc index creation failed handleId={} schema={} index={}",
            handle.id(), handle.schema(), index.name(), e);
      } finally {
        submitted.finished(index.name());
      }
    }
  }

  private <T> List<T> query(String op, SqlStatement ss, RowMapper<T> mapper) {
    try (Connection c = ds.getConnection()) {
      long start = System.nanoTime();
      debugSql(op, ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        try (ResultSet rs = ps.executeQuery()) {
          List<T> out = new ArrayList<>();
          while (rs.next()) out.add(mapper.map(rs));
          debugDone(op, ss, out.size(), System.nanoTime() - start);
          return out;
        }
      }
    } catch (SQLException e) {
      throw new IndexCatalogException("Catalog query " + op + " failed on " + handle.id(), e);
    }
  }

  private void execute(String op, SqlStatement ss, Duration timeout) {
    try (Connection c = ds.getConnection()) {
      // concurrent index DDL cannot run inside a transaction block
      c.setAutoCommit(true);
      long start = System.nanoTime();
      debugSql(op, ss);
      try (Statement st = c.createStatement()) {
        if (!timeout.isZero()) st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toSeconds()));
        st.execute(ss.sql());
        debugDone(op, ss, null, System.nanoTime() - start);
      }
    } catch (SQLException e) {
      throw new IndexCatalogException("Catalog statement " + op + " failed on " + handle.id(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      ps.setObject(i + 1, ss.binds().get(i));
    }
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("vigil.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), handle.id(), handle.schema(), ss.sql());
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("vigil.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    return r.getClass().getSimpleName();
  }

  private record CatalogRow(String indexName, String tableName, String definition, boolean valid, long relId) {
    static CatalogRow read(ResultSet rs) throws SQLException {
      return new CatalogRow(
          rs.getString("indexname"),
          rs.getString("tablename"),
          rs.getString("indexdef"),
          rs.getBoolean("indisvalid"),
          rs.getLong("indexrelid"));
    }
  }
}
