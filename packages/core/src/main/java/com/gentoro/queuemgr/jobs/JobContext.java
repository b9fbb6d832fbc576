package com.gentoro.queuemgr.jobs;

import java.util.concurrent.atomic.AtomicBoolean;

/** Context passed to {@link QueueJob#execute} with cancellation and progress hooks. */
public final class JobContext {
  private final String jobId;
  private final String jobType;
  private final CancelChecker cancelChecker;
  private final ProgressReporter progressReporter;
  private final AtomicBoolean cancelObserved = new AtomicBoolean();

  /** Checked by jobs to cooperatively cancel execution. */
  @FunctionalInterface
  public interface CancelChecker {
    boolean isCancelled();
  }

  /** Receives progress updates; {@code percent} is clamped to 0..100 by the supervisor. */
  @FunctionalInterface
  public interface ProgressReporter {
    void reportProgress(int percent, String description);
  }

  public JobContext(
      String jobId,
      String jobType,
      CancelChecker cancelChecker,
      ProgressReporter progressReporter) {
    this.jobId = jobId;
    this.jobType = jobType;
    this.cancelChecker = cancelChecker;
    this.progressReporter = progressReporter;
  }

  public String jobId() {
    return jobId;
  }

  public String jobType() {
    return jobType;
  }

  public boolean isCancelled() {
    boolean cancelled = cancelChecker != null && cancelChecker.isCancelled();
    if (cancelled) {
      cancelObserved.set(true);
    }
    return cancelled;
  }

  public void throwIfCancelled() throws JobCancelledException {
    if (isCancelled()) {
      throw new JobCancelledException("Job " + jobId + " cancelled");
    }
  }

  public void reportProgress(int percent, String description) {
    if (progressReporter != null) {
      progressReporter.reportProgress(percent, description);
    }
  }

  /** Whether the job saw a positive {@link #isCancelled()} answer at least once. */
  public boolean cancellationObserved() {
    return cancelObserved.get();
  }
}
