package io.intellixity.vigil.governance;

import io.intellixity.vigil.spi.catalog.CatalogHandle;

/**
 * Application-implemented resolver mapping an organization to the handle of its client database.\n
 *
 * Returning null means the organization has no client database configured.\n
 */
@FunctionalInterface
public interface CatalogHandleResolver {
  CatalogHandle<?> resolve(String organizationId);
}
