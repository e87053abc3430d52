package io.intellixity.vigil.server.config;

import com.zaxxer.hikari.HikariConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client databases keyed by organization id.\n
 *
 * A client database holds the organization's transaction tables; its aggregation indexes are built
 * and dropped there. Every organization listed here is swept for unused indexes.\n
 */
@ConfigurationProperties(prefix = "vigil.client")
public class ClientDatabasesProperties {
  private final Map<String, ClientDatabase> databases = new HashMap<>();

  public Map<String, ClientDatabase> getDatabases() { return databases; }

  public List<String> organizationIds() {
    List<String> ids = new ArrayList<>(databases.keySet());
    Collections.sort(ids);
    return ids;
  }

  public static class ClientDatabase {
    private String jdbcUrl;
    private String username;
    private String password;
    /** Schema holding the indexed tables. */
    private String schema = "public";
    /** Index builds hold a connection each for hours, so keep this above one. */
    private int maximumPoolSize = 5;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }

    HikariConfig toPoolConfig(String organizationId) {
      if (jdbcUrl == null || jdbcUrl.isBlank()) {
        throw new IllegalArgumentException("Missing jdbcUrl for organization " + organizationId);
      }
      HikariConfig hc = new HikariConfig();
      hc.setJdbcUrl(jdbcUrl);
      hc.setUsername(username);
      hc.setPassword(password);
      hc.setMaximumPoolSize(maximumPoolSize);
      hc.setPoolName("vigil-" + organizationId);
      return hc;
    }
  }
}
