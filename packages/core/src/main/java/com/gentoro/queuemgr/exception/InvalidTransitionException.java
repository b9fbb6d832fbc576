package com.gentoro.queuemgr.exception;

/**
 * Raised when a status change is not allowed by the job state machine. The record is left
 * untouched.
 */
public class InvalidTransitionException extends QueueMgrException {
  private final String jobId;
  private final String from;
  private final String to;

  public InvalidTransitionException(String jobId, String from, String to) {
    super(
        QueueMgrErrorCode.INVALID_TRANSITION,
        "Cannot move job '" + jobId + "' from " + from + " to " + to);
    this.jobId = jobId;
    this.from = from;
    this.to = to;
    withContext("jobId", jobId);
    withContext("from", from);
    withContext("to", to);
  }

  public String getJobId() {
    return jobId;
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }
}
