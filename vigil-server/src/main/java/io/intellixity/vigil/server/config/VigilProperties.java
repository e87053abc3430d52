package io.intellixity.vigil.server.config;

import io.intellixity.vigil.lifecycle.IndexLifecycleSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {
  private final MainDb mainDb = new MainDb();
  private final Indexes indexes = new Indexes();
  private final Jobs jobs = new Jobs();

  public MainDb getMainDb() { return mainDb; }
  public Indexes getIndexes() { return indexes; }
  public Jobs getJobs() { return jobs; }

  /** Database holding scenarios and their iterations. */
  public static class MainDb {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 5;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Indexes {
    private String dialect = "postgres";
    private Duration statusPollInterval = Duration.ofSeconds(1);
    private Duration resubmissionDelay = Duration.ofSeconds(30);
    private int creationPriority = 1;
    private Duration creationTimeout = Duration.ofHours(4);
    private int catalogCacheSize = 100;
    private Duration catalogCacheTtl = Duration.ofMinutes(10);
    private Duration deletionInterval = Duration.ofMinutes(30);
    private boolean deletionDryRun = true;

    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
    public Duration getStatusPollInterval() { return statusPollInterval; }
    public void setStatusPollInterval(Duration statusPollInterval) { this.statusPollInterval = statusPollInterval; }
    public Duration getResubmissionDelay() { return resubmissionDelay; }
    public void setResubmissionDelay(Duration resubmissionDelay) { this.resubmissionDelay = resubmissionDelay; }
    public int getCreationPriority() { return creationPriority; }
    public void setCreationPriority(int creationPriority) { this.creationPriority = creationPriority; }
    public Duration getCreationTimeout() { return creationTimeout; }
    public void setCreationTimeout(Duration creationTimeout) { this.creationTimeout = creationTimeout; }
    public int getCatalogCacheSize() { return catalogCacheSize; }
    public void setCatalogCacheSize(int catalogCacheSize) { this.catalogCacheSize = catalogCacheSize; }
    public Duration getCatalogCacheTtl() { return catalogCacheTtl; }
    public void setCatalogCacheTtl(Duration catalogCacheTtl) { this.catalogCacheTtl = catalogCacheTtl; }
    public Duration getDeletionInterval() { return deletionInterval; }
    public void setDeletionInterval(Duration deletionInterval) { this.deletionInterval = deletionInterval; }
    public boolean isDeletionDryRun() { return deletionDryRun; }
    public void setDeletionDryRun(boolean deletionDryRun) { this.deletionDryRun = deletionDryRun; }

    public IndexLifecycleSettings toSettings() {
      return new IndexLifecycleSettings(statusPollInterval, resubmissionDelay, creationPriority, deletionInterval, deletionDryRun);
    }
  }

  /** Retry policy of the in-process job queue. */
  public static class Jobs {
    private int maxAttempts = 5;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofMinutes(5);

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
  }
}
