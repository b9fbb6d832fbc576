package com.gentoro.queuemgr.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.registry.JobRecord;
import com.gentoro.queuemgr.registry.JobStatus;
import java.time.Instant;

/** Caller-facing view of a job: status, progress and, once terminal, result or error. */
public record JobStatusView(
    String jobId,
    String jobType,
    JobStatus status,
    int progress,
    String description,
    JsonNode result,
    JobError error,
    long sizeBytes,
    Instant createdAt,
    Instant updatedAt) {

  public static JobStatusView fromRecord(JobRecord r) {
    return new JobStatusView(
        r.jobId(),
        r.jobType(),
        r.status(),
        r.progress(),
        r.description(),
        r.result() == null ? null : r.result().deepCopy(),
        r.error(),
        r.sizeBytes(),
        r.createdAt(),
        r.updatedAt());
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
