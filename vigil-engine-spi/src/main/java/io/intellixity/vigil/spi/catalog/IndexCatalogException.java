package io.intellixity.vigil.spi.catalog;

/** Failure talking to a tenant catalog; the driver exception is kept as cause. */
public class IndexCatalogException extends RuntimeException {
  public IndexCatalogException(String message) {
    super(message);
  }

  public IndexCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
