package io.intellixity.vigil.spi.catalog;

/** Resolves the index catalog of an organization's client database. */
@FunctionalInterface
public interface IndexCatalogProvider {
  IndexCatalog forOrganization(String organizationId);
}
