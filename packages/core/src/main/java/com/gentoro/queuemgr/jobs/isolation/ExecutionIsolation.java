package com.gentoro.queuemgr.jobs.isolation;

import com.gentoro.queuemgr.jobs.JobDefinition;

/**
 * Strategy that decides where a job's code runs.
 *
 * <p>Every launch gets its own execution context, so a fault or a runaway job can affect neither
 * the supervisor nor other jobs beyond what the mode can contain: {@link ThreadIsolation} contains
 * exceptions, {@link ProcessIsolation} also contains crashes, memory exhaustion and jobs that
 * ignore cancellation.
 */
public interface ExecutionIsolation {

  /** Start executing the job described by {@code launch}. Never blocks on the job itself. */
  ExecutionHandle launch(JobLaunch launch);

  /** Whether jobs that ignore cancellation can be stopped forcibly. */
  boolean supportsTermination();

  /** Whether definitions built from a factory (without a job class) can run in this mode. */
  default boolean supports(JobDefinition definition) {
    return true;
  }

  String name();
}
