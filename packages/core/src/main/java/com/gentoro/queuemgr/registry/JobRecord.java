package com.gentoro.queuemgr.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of durable job state. Instances are immutable; every lifecycle change produces a new
 * record that is appended to the registry as a full line.
 *
 * <p>{@code params} and {@code result} are JSON trees owned by the record and must not be mutated
 * by callers. A record with {@code deleted == true} is a tombstone: it only keeps the job id
 * reserved after the job was removed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRecord(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("job_type") String jobType,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("params") JsonNode params,
    @JsonProperty("result") JsonNode result,
    @JsonProperty("error") JobError error,
    @JsonProperty("progress") int progress,
    @JsonProperty("description") String description,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("deleted") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean deleted) {

  @JsonCreator
  public JobRecord {
    if (result != null && result.isNull()) {
      result = null;
    }
  }

  /** Fresh CREATED record. */
  public static JobRecord created(String jobId, String jobType, JsonNode params, Instant now) {
    Objects.requireNonNull(now, "now");
    JsonNode p = params == null ? JsonNodeFactory.instance.objectNode() : params.deepCopy();
    return new JobRecord(
        jobId, jobType, JobStatus.CREATED, p, null, null, 0, "Job created", now, now, 0L, false);
  }

  public JobRecord withStatus(JobStatus newStatus, String newDescription, Instant now) {
    return new JobRecord(
        jobId,
        jobType,
        newStatus,
        params,
        result,
        error,
        progress,
        newDescription,
        createdAt,
        touch(now),
        sizeBytes,
        deleted);
  }

  public JobRecord withResult(JsonNode newResult, long newSizeBytes, Instant now) {
    return new JobRecord(
        jobId,
        jobType,
        JobStatus.COMPLETED,
        params,
        newResult,
        null,
        100,
        "Job completed successfully",
        createdAt,
        touch(now),
        newSizeBytes,
        deleted);
  }

  public JobRecord withError(JobError newError, Instant now) {
    return new JobRecord(
        jobId,
        jobType,
        JobStatus.FAILED,
        params,
        null,
        newError,
        progress,
        "Job failed: " + newError.message(),
        createdAt,
        touch(now),
        0L,
        deleted);
  }

  public JobRecord withProgress(int newProgress, String newDescription, Instant now) {
    int clamped = Math.max(0, Math.min(100, newProgress));
    return new JobRecord(
        jobId,
        jobType,
        status,
        params,
        result,
        error,
        clamped,
        newDescription == null ? description : newDescription,
        createdAt,
        touch(now),
        sizeBytes,
        deleted);
  }

  /** Tombstone that keeps the id reserved once the record itself is dropped. */
  public JobRecord toTombstone(Instant now) {
    return new JobRecord(
        jobId, jobType, status, null, null, null, progress, "Job deleted", createdAt, touch(now),
        0L, true);
  }

  /** {@code updated_at} never moves backwards, even if the clock does. */
  private Instant touch(Instant now) {
    return now.isBefore(updatedAt) ? updatedAt : now;
  }

  /** Returns a description of the first violated invariant, if any. */
  public Optional<String> invariantViolation() {
    if (jobId == null || jobId.isBlank()) return Optional.of("job_id is missing");
    if (status == null) return Optional.of("status is missing");
    if (createdAt == null || updatedAt == null) return Optional.of("timestamps are missing");
    if (updatedAt.isBefore(createdAt)) return Optional.of("updated_at is earlier than created_at");
    if (result != null && error != null) return Optional.of("result and error are both set");
    if (result != null && status != JobStatus.COMPLETED) {
      return Optional.of("result is set on a " + status + " record");
    }
    if (error != null && status != JobStatus.FAILED) {
      return Optional.of("error is set on a " + status + " record");
    }
    if (progress < 0 || progress > 100) return Optional.of("progress out of range: " + progress);
    if (sizeBytes < 0) return Optional.of("size_bytes is negative");
    return Optional.empty();
  }
}
