package com.gentoro.queuemgr.registry;

import java.util.List;

/**
 * Outcome of scanning the registry file when the store was opened.
 *
 * @param linesRead physical lines scanned
 * @param recordsLoaded lines decoded into records (including superseded ones)
 * @param trailingLineDiscarded whether an interrupted final write was cut off
 * @param discardedBytes bytes removed from the end of the file
 * @param rejectedLines interior lines that parsed but violated a record invariant
 */
public record RecoveryReport(
    long linesRead,
    long recordsLoaded,
    boolean trailingLineDiscarded,
    long discardedBytes,
    List<RejectedLine> rejectedLines) {

  /** An interior line skipped during recovery. */
  public record RejectedLine(long lineNumber, String reason) {}

  public boolean isClean() {
    return !trailingLineDiscarded && rejectedLines.isEmpty();
  }
}
