package io.intellixity.vigil.jdbc;

import io.intellixity.vigil.spi.catalog.CatalogHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC handle onto a tenant client database (resolved by application code). */
public final class JdbcHandle implements CatalogHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? "public" : schema;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }
}
