package com.gentoro.queuemgr.exception;

/** Deletion was requested for a job that has not reached a terminal state. */
public class JobNotTerminalException extends QueueMgrException {
  private final String jobId;
  private final String status;

  public JobNotTerminalException(String jobId, String status) {
    super(
        QueueMgrErrorCode.JOB_NOT_TERMINAL,
        "Cannot delete job '" + jobId + "' in state '" + status + "'");
    this.jobId = jobId;
    this.status = status;
    withContext("jobId", jobId);
    withContext("status", status);
  }

  public String getJobId() {
    return jobId;
  }

  public String getStatus() {
    return status;
  }
}
