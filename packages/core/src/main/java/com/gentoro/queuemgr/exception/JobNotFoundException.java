package com.gentoro.queuemgr.exception;

/** No live record exists for the requested job id. */
public class JobNotFoundException extends QueueMgrException {
  private final String jobId;

  public JobNotFoundException(String jobId) {
    super(QueueMgrErrorCode.NOT_FOUND, "Job with ID '" + jobId + "' not found");
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}
