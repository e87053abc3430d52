package io.intellixity.vigil.spi.jobs;

/**
 * Handles every job of one kind.\n
 *
 * A runtime exception is a failed attempt, which the queue retries with backoff up to its attempt
 * limit.\n
 */
public interface JobWorker<A extends JobArgs> {
  String kind();

  Class<A> argsType();

  JobResult work(Job<A> job);
}
