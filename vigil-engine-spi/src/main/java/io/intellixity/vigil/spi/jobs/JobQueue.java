package io.intellixity.vigil.spi.jobs;

/** Durable or in-process job queue used by the index lifecycle. */
public interface JobQueue {
  /** @return the job id */
  long enqueue(JobArgs args, InsertOpts opts);
}
