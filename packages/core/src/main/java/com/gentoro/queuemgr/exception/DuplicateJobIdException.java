package com.gentoro.queuemgr.exception;

/** A job id was submitted that already exists, or once existed, in the registry. */
public class DuplicateJobIdException extends QueueMgrException {
  private final String jobId;

  public DuplicateJobIdException(String jobId) {
    super(QueueMgrErrorCode.DUPLICATE_JOB_ID, "Job with ID '" + jobId + "' already exists");
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}
