package com.gentoro.queuemgr.jobs;

/**
 * Thrown by job logic to acknowledge a cancellation request, typically via {@link
 * JobContext#throwIfCancelled()}.
 */
public class JobCancelledException extends Exception {
  public JobCancelledException(String message) {
    super(message);
  }
}
