package io.intellixity.vigil.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.vigil.advisor.IndexAdvisor;
import io.intellixity.vigil.governance.CatalogHandleResolver;
import io.intellixity.vigil.governance.GovernanceIndexCatalogResolver;
import io.intellixity.vigil.governance.GovernedIndexSecurity;
import io.intellixity.vigil.governance.IndexCatalogFactory;
import io.intellixity.vigil.jdbc.JdbcHandle;
import io.intellixity.vigil.jdbc.JdbcIndexCatalog;
import io.intellixity.vigil.jdbc.dialect.IndexDialect;
import io.intellixity.vigil.jdbc.dialect.IndexDialects;
import io.intellixity.vigil.lifecycle.IndexLifecycleOrchestrator;
import io.intellixity.vigil.lifecycle.IndexLifecycleSettings;
import io.intellixity.vigil.lifecycle.jobs.IndexCreationStatusWorker;
import io.intellixity.vigil.lifecycle.jobs.IndexCreationWorker;
import io.intellixity.vigil.lifecycle.jobs.IndexDeletionWorker;
import io.intellixity.vigil.server.jobs.InProcessJobQueue;
import io.intellixity.vigil.server.jobs.IndexDeletionScheduler;
import io.intellixity.vigil.server.scenario.JdbcScenarioFetcher;
import io.intellixity.vigil.spi.scenario.ScenarioFetcher;
import io.intellixity.vigil.spi.security.IndexSecurity;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

@Configuration
@EnableConfigurationProperties({ClientDatabasesProperties.class, VigilProperties.class})
public class VigilServerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public IndexLifecycleSettings indexLifecycleSettings(VigilProperties props) {
    return props.getIndexes().toSettings();
  }

  @Bean
  public IndexAdvisor indexAdvisor() {
    return new IndexAdvisor();
  }

  @Bean(destroyMethod = "close")
  public ClientPools clientPools() {
    return new ClientPools();
  }

  @Bean
  public CatalogHandleResolver catalogHandleResolver(ClientDatabasesProperties props, ClientPools pools) {
    return organizationId -> {
      ClientDatabasesProperties.ClientDatabase db = props.getDatabases().get(organizationId);
      if (db == null) return null;
      return new JdbcHandle("jdbc:" + organizationId, pools.forOrganization(organizationId, db), db.getSchema());
    };
  }

  @Bean
  public IndexDialect indexDialect(VigilProperties props) {
    return IndexDialects.byId(props.getIndexes().getDialect());
  }

  @Bean(destroyMethod = "close")
  public DdlExecutors ddlExecutors() {
    return new DdlExecutors();
  }

  @Bean
  public IndexCatalogFactory indexCatalogFactory(IndexDialect dialect, DdlExecutors executors, VigilProperties props) {
    return handle -> {
      if (!(handle instanceof JdbcHandle h)) {
        throw new IllegalArgumentException("Unsupported catalog handle: " + handle.getClass().getName());
      }
      return new JdbcIndexCatalog(h, dialect, executors.forHandle(h.id()), props.getIndexes().getCreationTimeout(),
          executors.buildsForHandle(h.id()));
    };
  }

  @Bean
  public GovernanceIndexCatalogResolver indexCatalogResolver(CatalogHandleResolver handles,
                                                             IndexCatalogFactory factory,
                                                             VigilProperties props) {
    VigilProperties.Indexes idx = props.getIndexes();
    return new GovernanceIndexCatalogResolver(handles, factory,
        idx.getCatalogCacheSize(), idx.getCatalogCacheSize(), idx.getCatalogCacheTtl().toMillis());
  }

  @Bean
  public IndexSecurity indexSecurity() {
    return new GovernedIndexSecurity();
  }

  @Bean(destroyMethod = "close")
  public HikariDataSource mainDataSource(VigilProperties props) {
    VigilProperties.MainDb db = props.getMainDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("vigil.main-db.jdbc-url is required");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setPoolName("vigil-main");
    return new HikariDataSource(hc);
  }

  @Bean
  public ScenarioFetcher scenarioFetcher(HikariDataSource mainDataSource, ObjectMapper json) {
    return new JdbcScenarioFetcher(mainDataSource, json);
  }

  @Bean(destroyMethod = "close")
  public InProcessJobQueue jobQueue(VigilProperties props,
                                    GovernanceIndexCatalogResolver catalogs,
                                    ScenarioFetcher scenarios,
                                    IndexAdvisor advisor,
                                    IndexLifecycleSettings settings,
                                    Clock clock) {
    VigilProperties.Jobs jobs = props.getJobs();
    InProcessJobQueue queue = new InProcessJobQueue(
        new InProcessJobQueue.RetryPolicy(jobs.getMaxAttempts(), jobs.getInitialBackoff(), jobs.getMaxBackoff()), clock);
    queue.register(new IndexCreationWorker(catalogs, queue, settings, clock))
        .register(new IndexCreationStatusWorker(catalogs, queue, settings, UUID::randomUUID, clock))
        .register(new IndexDeletionWorker(catalogs, scenarios, advisor, settings));
    return queue;
  }

  @Bean
  public IndexLifecycleOrchestrator indexLifecycleOrchestrator(ScenarioFetcher scenarios,
                                                               GovernanceIndexCatalogResolver catalogs,
                                                               IndexSecurity security,
                                                               InProcessJobQueue queue,
                                                               IndexAdvisor advisor,
                                                               IndexLifecycleSettings settings,
                                                               Clock clock) {
    return new IndexLifecycleOrchestrator(scenarios, catalogs, security, queue, advisor, settings, UUID::randomUUID, clock);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public IndexDeletionScheduler indexDeletionScheduler(InProcessJobQueue queue,
                                                       ClientDatabasesProperties clients,
                                                       IndexLifecycleSettings settings,
                                                       Clock clock) {
    return new IndexDeletionScheduler(queue, clients.organizationIds(), settings.deletionInterval(), clock);
  }
}
