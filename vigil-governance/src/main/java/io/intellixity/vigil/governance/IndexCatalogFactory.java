package io.intellixity.vigil.governance;

import io.intellixity.vigil.spi.catalog.CatalogHandle;
import io.intellixity.vigil.spi.catalog.IndexCatalog;

@FunctionalInterface
public interface IndexCatalogFactory {
  IndexCatalog create(CatalogHandle<?> handle);
}
