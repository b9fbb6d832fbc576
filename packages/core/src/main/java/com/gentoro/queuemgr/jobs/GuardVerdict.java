package com.gentoro.queuemgr.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.queuemgr.exception.ResultRejectedException;

/**
 * Outcome of {@link ResultGuard#validate(Object)}: either the normalized result with its
 * serialized size, or the rejection.
 */
public record GuardVerdict(JsonNode value, long sizeBytes, ResultRejectedException rejection) {

  static GuardVerdict accepted(JsonNode value, long sizeBytes) {
    return new GuardVerdict(value, sizeBytes, null);
  }

  static GuardVerdict rejected(ResultRejectedException rejection) {
    return new GuardVerdict(null, 0L, rejection);
  }

  public boolean isAccepted() {
    return rejection == null;
  }
}
