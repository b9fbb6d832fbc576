package com.gentoro.queuemgr.registry;

/** Lifecycle state of a job record. */
public enum JobStatus {
  /** Record exists, job not yet admitted to the worker pool. */
  CREATED,
  /** Admitted to the worker pool, waiting for a free slot. */
  QUEUED,
  /** Executing in its own execution context. */
  RUNNING,
  /** Finished normally and the result was committed. */
  COMPLETED,
  /** Job logic raised, timed out, or its result was rejected. */
  FAILED,
  /** Cancelled before or during execution. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
