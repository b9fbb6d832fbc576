package com.gentoro.queuemgr.jobs;

import java.time.Duration;
import java.util.Objects;

/**
 * Which records a cleanup pass removes.
 *
 * @param maxAge records whose last update is older than this are eligible
 * @param terminalOnly when {@code false}, stale CREATED and QUEUED jobs are cancelled and removed
 *     too; RUNNING jobs are never touched
 */
public record RetentionPolicy(Duration maxAge, boolean terminalOnly) {

  public RetentionPolicy {
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must not be negative");
    }
  }

  public static RetentionPolicy terminalOlderThan(Duration maxAge) {
    return new RetentionPolicy(maxAge, true);
  }
}
