package io.intellixity.vigil.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/** One connection pool per organization's client database, opened on first use and closed together. */
public final class ClientPools implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ClientPools.class);

  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();
  private final Function<HikariConfig, HikariDataSource> opener;
  private volatile boolean closed;

  public ClientPools() {
    this(HikariDataSource::new);
  }

  ClientPools(Function<HikariConfig, HikariDataSource> opener) {
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  public HikariDataSource forOrganization(String organizationId, ClientDatabasesProperties.ClientDatabase db) {
    if (closed) throw new IllegalStateException("Client pools are closed");
    return pools.computeIfAbsent(organizationId, org -> opener.apply(db.toPoolConfig(org)));
  }

  @Override
  public void close() {
    closed = true;
    pools.forEach((org, ds) -> {
      ds.close();
      log.info("vigil.server closed client pool org={}", org);
    });
    pools.clear();
  }
}
