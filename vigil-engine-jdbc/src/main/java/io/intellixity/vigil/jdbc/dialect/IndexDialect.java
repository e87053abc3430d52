package io.intellixity.vigil.jdbc.dialect;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.jdbc.SqlStatement;

/**
 * Catalog SQL of one database engine.\n
 *
 * Query statements must expose the column labels documented on each method; the catalog reads rows
 * by label.\n
 */
public interface IndexDialect {
  /** Stable id, used to pick a dialect from configuration. */
  String id();

  /** Rows: {@code indexname, tablename, indexdef, indisvalid, indexrelid}. */
  SqlStatement listIndexes(String schema);

  /** Rows: {@code index_relid} of every index build in progress. */
  SqlStatement listIndexesInCreation();

  /** Rows: {@code indexname} of concurrent builds running in the schema. */
  SqlStatement listPendingCreation(String schema);

  /** Rows: {@code indexname} of invalid indexes in the schema. */
  SqlStatement listInvalidIndexes(String schema);

  SqlStatement createIndex(String schema, ConcreteIndex index);

  SqlStatement dropIndex(String schema, String indexName);

  IndexDefinition parseIndexDefinition(String definition);
}
