package io.intellixity.vigil.spi.catalog;

import io.intellixity.vigil.advisor.model.ConcreteIndex;
import io.intellixity.vigil.advisor.model.IndexType;

import java.util.List;

/**
 * Physical index catalog of one tenant database.\n
 *
 * Reads are synchronous. {@link #createIndexesAsync(List)} returns as soon as the work is handed to
 * a background executor; progress is observed through the pending and invalid listings.\n
 */
public interface IndexCatalog {

  /** Valid indexes; all types when {@code types} is empty. */
  List<ConcreteIndex> listAllValidIndexes(IndexType... types);

  /** Every index with its status; all types when {@code types} is empty. */
  List<ConcreteIndex> listAllIndexes(IndexType... types);

  /** Number of index builds currently running. */
  int countPendingIndexes();

  /** Names of the indexes whose concurrent build has started and is not finished. */
  List<String> listIndicesPendingCreation();

  /** Names of the indexes left invalid by a failed or interrupted build. */
  List<String> listInvalidIndices();

  void dropIndex(String indexName);

  /** Start building the given named indexes one after another in the background. */
  void createIndexesAsync(List<ConcreteIndex> indexes);
}
