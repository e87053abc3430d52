package io.intellixity.vigil.server.config;

import io.intellixity.vigil.jdbc.SubmittedIndexBuilds;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * One single-threaded DDL executor per catalog handle, so builds on a tenant database never overlap.
 * The submitted builds of a handle are kept here too, so they outlive cache evictions of its catalog.
 */
public final class DdlExecutors implements AutoCloseable {
  private final Map<String, ExecutorService> executors = new ConcurrentHashMap<>();
  private final Map<String, SubmittedIndexBuilds> builds = new ConcurrentHashMap<>();

  public ExecutorService forHandle(String handleId) {
    return executors.computeIfAbsent(handleId, id -> Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "vigil-ddl-" + id);
      t.setDaemon(true);
      return t;
    }));
  }

  public SubmittedIndexBuilds buildsForHandle(String handleId) {
    return builds.computeIfAbsent(handleId, id -> new SubmittedIndexBuilds());
  }

  @Override
  public void close() {
    executors.values().forEach(ExecutorService::shutdownNow);
  }
}
