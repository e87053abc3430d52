package io.intellixity.vigil.governance;

import io.intellixity.vigil.governance.internal.LruTtlCache;
import io.intellixity.vigil.spi.catalog.CatalogHandle;
import io.intellixity.vigil.spi.catalog.IndexCatalog;
import io.intellixity.vigil.spi.catalog.IndexCatalogProvider;
import io.intellixity.vigil.spi.scenario.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Cache-backed {@link IndexCatalogProvider}.\n
 *
 * Caches:\n
 * - CatalogHandle by organization id\n
 * - IndexCatalog by handle id, so organizations sharing a database share a catalog\n
 */
public final class GovernanceIndexCatalogResolver implements IndexCatalogProvider {
  private static final Logger log = LoggerFactory.getLogger(GovernanceIndexCatalogResolver.class);

  private final CatalogHandleResolver handleResolver;
  private final IndexCatalogFactory catalogFactory;

  private final LruTtlCache<String, CatalogHandle<?>> handles;
  private final LruTtlCache<String, IndexCatalog> catalogs;

  public GovernanceIndexCatalogResolver(CatalogHandleResolver handleResolver,
                                        IndexCatalogFactory catalogFactory,
                                        int maxHandles,
                                        int maxCatalogs,
                                        long ttlMillis) {
    this(handleResolver, catalogFactory, maxHandles, maxCatalogs, ttlMillis, 0);
  }

  public GovernanceIndexCatalogResolver(CatalogHandleResolver handleResolver,
                                        IndexCatalogFactory catalogFactory,
                                        int maxHandles,
                                        int maxCatalogs,
                                        long ttlMillis,
                                        long idleMillis) {
    this.handleResolver = Objects.requireNonNull(handleResolver, "handleResolver");
    this.catalogFactory = Objects.requireNonNull(catalogFactory, "catalogFactory");
    this.handles = new LruTtlCache<>(maxHandles, ttlMillis, idleMillis, System::currentTimeMillis,
        (org, h) -> log.debug("vigil.governance handle evicted org={} handleId={}", org, h.id()));
    this.catalogs = new LruTtlCache<>(maxCatalogs, ttlMillis, idleMillis, System::currentTimeMillis,
        (id, c) -> log.debug("vigil.governance catalog evicted handleId={}", id));
  }

  @Override
  public IndexCatalog forOrganization(String organizationId) {
    Objects.requireNonNull(organizationId, "organizationId");
    String org = organizationId.trim();
    if (org.isEmpty()) throw new IllegalArgumentException("organizationId is blank");

    CatalogHandle<?> handle = handles.getOrCompute(org, () -> handleResolver.resolve(org));
    if (handle == null) throw new NotFoundException("No client database configured for organization " + org);

    IndexCatalog catalog = catalogs.getOrCompute(handle.id(), () -> catalogFactory.create(handle));
    if (catalog == null) throw new IllegalStateException("IndexCatalogFactory returned null for handle " + handle.id());
    return catalog;
  }

  /** Catalog of the organization bound to the current governance context. */
  public IndexCatalog current() {
    return forOrganization(Governance.currentOrThrow().organizationId());
  }
}
