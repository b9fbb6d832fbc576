package com.gentoro.queuemgr.jobs.isolation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.queuemgr.jobs.JobOutcome;
import java.util.Map;

/**
 * Line-oriented JSON protocol between {@link ProcessIsolation} and {@link ChildJobRunner}.
 *
 * <p>The parent writes one {@link Request} line to the child's standard input, followed by zero or
 * more command lines ({@value #CANCEL}). The child answers on standard output with {@link Event}
 * lines: any number of progress events and, last, exactly one outcome event.
 */
public final class ChildProtocol {
  public static final String CANCEL = "cancel";
  public static final String EVENT_PROGRESS = "progress";
  public static final String EVENT_OUTCOME = "outcome";

  private ChildProtocol() {}

  public record Request(
      @JsonProperty("job_id") String jobId,
      @JsonProperty("job_type") String jobType,
      @JsonProperty("job_class") String jobClass,
      @JsonProperty("params") Map<String, Object> params,
      @JsonProperty("warn_bytes") long warnBytes,
      @JsonProperty("max_bytes") long maxBytes) {}

  public record Event(
      @JsonProperty("event") String event,
      @JsonProperty("progress") Integer progress,
      @JsonProperty("description") String description,
      @JsonProperty("outcome") JobOutcome outcome) {

    static Event progress(int progress, String description) {
      return new Event(EVENT_PROGRESS, progress, description, null);
    }

    static Event outcome(JobOutcome outcome) {
      return new Event(EVENT_OUTCOME, null, null, outcome);
    }
  }
}
