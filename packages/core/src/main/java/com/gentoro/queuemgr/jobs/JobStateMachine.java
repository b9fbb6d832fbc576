package com.gentoro.queuemgr.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.queuemgr.exception.InvalidTransitionException;
import com.gentoro.queuemgr.registry.JobError;
import com.gentoro.queuemgr.registry.JobRecord;
import com.gentoro.queuemgr.registry.JobStatus;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Valid status transitions and their side effects on a {@link JobRecord}.
 *
 * <pre>
 * CREATED -> QUEUED -> RUNNING -> COMPLETED | FAILED | CANCELLED
 * CREATED -> CANCELLED, QUEUED -> CANCELLED
 * </pre>
 *
 * Terminal states have no outgoing edges. Every method returns a new record and leaves the input
 * untouched; an illegal move raises {@link InvalidTransitionException}.
 */
public final class JobStateMachine {
  private static final Map<JobStatus, Set<JobStatus>> EDGES = new EnumMap<>(JobStatus.class);

  static {
    EDGES.put(JobStatus.CREATED, EnumSet.of(JobStatus.QUEUED, JobStatus.CANCELLED));
    EDGES.put(JobStatus.QUEUED, EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED));
    EDGES.put(
        JobStatus.RUNNING,
        EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED));
    EDGES.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
    EDGES.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
    EDGES.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
  }

  private JobStateMachine() {}

  public static boolean canTransition(JobStatus from, JobStatus to) {
    return EDGES.get(from).contains(to);
  }

  public static Set<JobStatus> successors(JobStatus from) {
    Set<JobStatus> next = EnumSet.noneOf(JobStatus.class);
    next.addAll(EDGES.get(from));
    return next;
  }

  /** CREATED to QUEUED: admitted to the worker pool. */
  public static JobRecord admit(JobRecord record, Instant now) {
    require(record, JobStatus.QUEUED);
    return record.withStatus(JobStatus.QUEUED, "Job queued", now);
  }

  /** QUEUED to RUNNING: a worker slot picked the job up. */
  public static JobRecord start(JobRecord record, Instant now) {
    require(record, JobStatus.RUNNING);
    return record.withStatus(JobStatus.RUNNING, "Job started", now);
  }

  /** RUNNING to COMPLETED with a result that already passed the result guard. */
  public static JobRecord complete(JobRecord record, JsonNode result, long sizeBytes, Instant now) {
    require(record, JobStatus.COMPLETED);
    return record.withResult(result, sizeBytes, now);
  }

  /** RUNNING to FAILED. */
  public static JobRecord fail(JobRecord record, JobError error, Instant now) {
    require(record, JobStatus.FAILED);
    return record.withError(error, now);
  }

  /** Any non-terminal state to CANCELLED. */
  public static JobRecord cancel(JobRecord record, String reason, Instant now) {
    require(record, JobStatus.CANCELLED);
    return record.withStatus(JobStatus.CANCELLED, reason, now);
  }

  private static void require(JobRecord record, JobStatus to) {
    if (!canTransition(record.status(), to)) {
      throw new InvalidTransitionException(record.jobId(), record.status().name(), to.name());
    }
  }
}
