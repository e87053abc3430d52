package io.intellixity.vigil.jdbc;

import io.intellixity.vigil.advisor.model.ConcreteIndex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Index builds handed to a DDL executor whose statement has not completed yet.\n
 *
 * A queued build has no server-side activity until its statement starts, so catalogs report these
 * names as pending next to what the database itself shows. Share one instance per client database.\n
 */
public final class SubmittedIndexBuilds {
  private final Set<String> names = ConcurrentHashMap.newKeySet();

  void submitted(Collection<ConcreteIndex> indexes) {
    for (ConcreteIndex i : indexes) names.add(i.name());
  }

  void finished(String indexName) {
    names.remove(indexName);
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  /** Sorted snapshot of the unfinished builds. */
  public List<String> names() {
    List<String> out = new ArrayList<>(names);
    Collections.sort(out);
    return out;
  }
}
