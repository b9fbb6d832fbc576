package com.gentoro.queuemgr.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.queuemgr.registry.JobError;
import java.util.List;
import java.util.Set;

/**
 * What one execution produced, as reported back from its execution context.
 *
 * <p>Exactly one of {@code result}-accepted or {@code fault} applies: a {@code null} fault means
 * the job returned normally and its value passed the result guard ({@code result} may still be
 * {@code null} when the job returned nothing). The record is JSON-serializable so that a child
 * process can ship it over its output stream.
 */
public record JobOutcome(
    @JsonProperty("result") JsonNode result,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("fault") JobError fault,
    @JsonProperty("rejected") boolean rejected,
    @JsonProperty("cancel_observed") boolean cancelObserved,
    @JsonProperty("warnings") List<SupervisorWarning> warnings) {

  /** Fault kinds that represent a job stopping because it was asked to. */
  private static final Set<String> CANCELLATION_KINDS =
      Set.of(
          JobCancelledException.class.getSimpleName(),
          InterruptedException.class.getSimpleName(),
          "CancellationException");

  public JobOutcome {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  static JobOutcome completed(
      JsonNode result, long sizeBytes, boolean cancelObserved, List<SupervisorWarning> warnings) {
    return new JobOutcome(result, sizeBytes, null, false, cancelObserved, warnings);
  }

  static JobOutcome failed(
      JobError fault, boolean cancelObserved, List<SupervisorWarning> warnings) {
    return new JobOutcome(null, 0L, fault, false, cancelObserved, warnings);
  }

  static JobOutcome rejected(
      JobError fault, boolean cancelObserved, List<SupervisorWarning> warnings) {
    return new JobOutcome(null, 0L, fault, true, cancelObserved, warnings);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return fault == null;
  }

  /** Whether the fault is the job giving up in response to cancellation. */
  @JsonIgnore
  public boolean isCancellationFault() {
    return fault != null && !rejected && CANCELLATION_KINDS.contains(fault.kind());
  }
}
