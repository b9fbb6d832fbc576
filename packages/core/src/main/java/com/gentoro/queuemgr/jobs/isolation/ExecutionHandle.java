package com.gentoro.queuemgr.jobs.isolation;

import com.gentoro.queuemgr.jobs.JobOutcome;
import java.util.concurrent.CompletableFuture;

/** Supervisor's grip on one launched execution. */
public interface ExecutionHandle {

  /** Completes with the job's outcome once its execution context has finished. */
  CompletableFuture<JobOutcome> outcome();

  /** Signal cooperative cancellation. Safe to call more than once and after completion. */
  void requestCancel();

  /**
   * Stop the execution forcibly.
   *
   * @return {@code false} when the mode cannot terminate it and the execution is abandoned
   */
  boolean terminate();
}
