package io.intellixity.vigil.spi.catalog;

/**
 * Resolved runtime handle onto a tenant's client database.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is the schema holding the ingested tables\n
 */
public interface CatalogHandle<TClient> {
  /** Unique identifier for this handle (useful for logging/caching). */
  String id();

  /** Native client used by a catalog (DataSource, ...). */
  TClient client();

  /** Namespace (schema) holding the tenant tables. */
  String namespace();
}
