package io.intellixity.vigil.spi.jobs;

/** Payload of a queued job; {@link #kind()} selects the worker. */
public interface JobArgs {
  String kind();

  String organizationId();
}
