package com.gentoro.queuemgr.jobs;

/**
 * Capability contract implemented by user job logic.
 *
 * <p>An instance is created for a single execution from {@code (jobId, params)} and runs inside its
 * own execution context. The supervisor calls the hooks in this order: {@link #onStart()}, {@link
 * #execute(JobContext)}, then {@link #onEnd()} after either outcome and, when {@code execute}
 * threw, {@link #onError(Throwable)}. Exceptions from hooks are recorded as warnings and never
 * change the job's terminal state.
 *
 * <p>Cancellation is cooperative: long-running logic should poll {@link JobContext#isCancelled()}
 * or call {@link JobContext#throwIfCancelled()}.
 */
public interface QueueJob {

  /** Invoked when the job transitions to RUNNING, before {@link #execute}. */
  default void onStart() throws Exception {}

  /**
   * Main job logic.
   *
   * @return the result to store with the COMPLETED record; {@code null} stores no result. Must be
   *     serializable to JSON.
   */
  Object execute(JobContext context) throws Exception;

  /** Invoked after {@link #execute} returned or threw. */
  default void onEnd() throws Exception {}

  /** Invoked with the fault when {@link #execute} threw. */
  default void onError(Throwable fault) throws Exception {}
}
