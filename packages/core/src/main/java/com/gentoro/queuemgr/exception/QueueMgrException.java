package com.gentoro.queuemgr.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type of every error raised by the queue manager.
 *
 * <p>Each exception carries a {@link QueueMgrErrorCode} and an optional, ordered context map with
 * the identifiers involved (job id, status, file, ...).
 */
public class QueueMgrException extends RuntimeException {
  private final QueueMgrErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public QueueMgrException(QueueMgrErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public QueueMgrException(QueueMgrErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public QueueMgrErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry; returns {@code this} for chaining at the throw site. */
  public QueueMgrException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
