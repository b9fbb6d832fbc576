package com.gentoro.queuemgr.exception;

import com.gentoro.queuemgr.registry.JobError;

/** Helpers turning exceptions into persisted job errors. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Build the persisted fault description of a job failure: the throwable's simple class name as
   * kind, its message (falling back to the kind when the message is empty) and a compact stack.
   */
  public static JobError toJobError(Throwable t) {
    String kind = t.getClass().getSimpleName();
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      message = kind;
    }
    return new JobError(kind, message, formatCompactStackTrace(t));
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frame first.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }
}
