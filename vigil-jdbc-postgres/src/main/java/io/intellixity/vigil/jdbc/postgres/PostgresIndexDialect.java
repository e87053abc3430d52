package io.intellixity.vigil.jdbc.postgres;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.jdbc.SqlStatement;
import io.intellixity.vigil.jdbc.dialect.AbstractIndexDialect;
import io.intellixity.vigil.jdbc.dialect.IndexDefinition;
import io.intellixity.vigil.jdbc.dialect.IndexDialect;

import java.util.List;

/**
 * Postgres catalog SQL.\n
 *
 * Advisor indexes are btree, every key column descending, built concurrently and partial on the
 * rows still current ({@code valid_until = 'infinity'}).\n
 */
public final class PostgresIndexDialect extends AbstractIndexDialect implements IndexDialect {

  static final String LIST_INDEXES = """
      SELECT
        pg_get_indexdef(pg_class_idx.oid) AS indexdef,
        pg_class_idx.relname AS indexname,
        pgidx.indisvalid,
        pgidx.indexrelid,
        pgidx.indisunique,
        pg_class_table.relname AS tablename
      FROM pg_namespace AS pgn
      INNER JOIN pg_class AS pg_class_table ON (pgn.oid = pg_class_table.relnamespace)
      INNER JOIN pg_index AS pgidx ON (pgidx.indrelid = pg_class_table.oid)
      INNER JOIN pg_class AS pg_class_idx ON (pgidx.indexrelid = pg_class_idx.oid)
      WHERE nspname = ?""";

  static final String LIST_IN_CREATION = "SELECT index_relid FROM pg_stat_progress_create_index";

  static final String LIST_PENDING = """
      SELECT
        coalesce(
          pgai.indexrelname,
          split_part(trim(split_part(pga.query, 'concurrently', 2)), ' ', 1)
        ) AS indexname
      FROM pg_stat_activity pga
      LEFT JOIN pg_stat_progress_create_index pgi ON pga.pid = pgi.pid
      LEFT JOIN pg_class pgc ON pgc.oid = pgi.relid
      LEFT JOIN pg_stat_all_indexes pgai ON pgai.relname = pgc.relname AND pgai.indexrelid = pgi.index_relid
      LEFT JOIN pg_namespace pgn ON pgn.oid = pgc.relnamespace
      WHERE
        pgn.nspname = ? AND
        (pga.query ILIKE 'create index concurrently %' OR pga.query ILIKE 'create unique index concurrently %') AND
        pga.leader_pid IS NULL""";

  static final String LIST_INVALID = """
      SELECT pgc.relname AS indexname
      FROM pg_index pgi
      LEFT JOIN pg_class pgc ON pgc.oid = pgi.indexrelid
      LEFT JOIN pg_namespace pgn ON pgn.oid = pgc.relnamespace
      WHERE
        pgn.nspname = ? AND
        pgi.indisvalid = false""";

  static final String CURRENT_ROWS_PREDICATE = "valid_until = 'infinity'";

  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public SqlStatement listIndexes(String schema) {
    return new SqlStatement(LIST_INDEXES, List.of(schema));
  }

  @Override
  public SqlStatement listIndexesInCreation() {
    return new SqlStatement(LIST_IN_CREATION, List.of());
  }

  @Override
  public SqlStatement listPendingCreation(String schema) {
    return new SqlStatement(LIST_PENDING, List.of(schema));
  }

  @Override
  public SqlStatement listInvalidIndexes(String schema) {
    return new SqlStatement(LIST_INVALID, List.of(schema));
  }

  @Override
  public SqlStatement createIndex(String schema, ConcreteIndex index) {
    if (index.name() == null) throw new IllegalArgumentException("Index must be named: " + index);
    if (index.indexed().isEmpty()) throw new IllegalArgumentException("Index has no key column: " + index);
    StringBuilder sql = new StringBuilder("CREATE INDEX CONCURRENTLY IF NOT EXISTS ")
        .append(quoteIdent(index.name()))
        .append(" ON ").append(qualified(schema, index.tableName()))
        .append(" USING btree (").append(columnList(index.indexed(), c -> quoteIdent(c) + " DESC")).append(")");
    if (!index.included().isEmpty()) {
      sql.append(" INCLUDE (").append(columnList(index.included(), this::quoteIdent)).append(")");
    }
    sql.append(" WHERE ").append(CURRENT_ROWS_PREDICATE);
    return SqlStatement.ddl(sql.toString());
  }

  @Override
  public SqlStatement dropIndex(String schema, String indexName) {
    return SqlStatement.ddl("DROP INDEX CONCURRENTLY IF EXISTS " + qualified(schema, indexName));
  }

  @Override
  public IndexDefinition parseIndexDefinition(String definition) {
    return PgIndexDefParser.parse(definition);
  }
}
