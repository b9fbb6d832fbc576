package com.gentoro.queuemgr.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured failure description persisted with a FAILED record.
 *
 * @param kind failure category, e.g. the simple class name of the fault, {@code Timeout} or
 *     {@code ResultRejected}
 * @param message human readable message, never empty
 * @param details optional compact stack trace or rejection reason
 */
public record JobError(
    @JsonProperty("kind") String kind,
    @JsonProperty("message") String message,
    @JsonProperty("details") String details) {

  public static final String KIND_TIMEOUT = "Timeout";
  public static final String KIND_RESULT_REJECTED = "ResultRejected";
  public static final String KIND_ORPHANED = "Orphaned";

  @JsonCreator
  public JobError {}

  public static JobError of(String kind, String message) {
    return new JobError(kind, message, null);
  }
}
