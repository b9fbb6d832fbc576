package com.gentoro.queuemgr.jobs;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Convenience base class holding the job id and parameters. Subclasses must expose a public
 * {@code (String jobId, Map<String, Object> params)} constructor to be usable with {@link
 * JobDefinition#of(Class)}.
 */
public abstract class QueueJobBase implements QueueJob {
  private final String jobId;
  private final Map<String, Object> params;

  protected QueueJobBase(String jobId, Map<String, Object> params) {
    if (jobId == null || jobId.isBlank()) {
      throw new IllegalArgumentException("job_id must be a non-empty string");
    }
    this.jobId = jobId;
    this.params = params == null ? Map.of() : Collections.unmodifiableMap(params);
  }

  public String jobId() {
    return jobId;
  }

  public Map<String, Object> params() {
    return params;
  }

  /** Required parameter lookup. */
  protected <T> T param(String name, Class<T> type) {
    Object value = params.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Missing parameter '" + name + "'");
    }
    if (Number.class.isAssignableFrom(type) && value instanceof Number n) {
      return type.cast(convertNumber(n, type));
    }
    return type.cast(value);
  }

  protected <T> T param(String name, Class<T> type, T defaultValue) {
    return params.containsKey(name) ? param(name, type) : defaultValue;
  }

  private static Object convertNumber(Number n, Class<?> type) {
    if (type == Integer.class) return n.intValue();
    if (type == Long.class) return n.longValue();
    if (type == Double.class) return n.doubleValue();
    if (type == Float.class) return n.floatValue();
    return n;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + Objects.toString(jobId) + "]";
  }
}
