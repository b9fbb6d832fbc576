package com.gentoro.queuemgr.exception;

/** A job result failed validation and was not committed. */
public class ResultRejectedException extends QueueMgrException {

  /** Why the result guard refused a value. */
  public enum Reason {
    NON_SERIALIZABLE,
    OVERSIZED
  }

  private final Reason reason;

  public ResultRejectedException(Reason reason, String message) {
    super(QueueMgrErrorCode.RESULT_REJECTED, message);
    this.reason = reason;
    withContext("reason", reason.name());
  }

  public ResultRejectedException(Reason reason, String message, Throwable cause) {
    super(QueueMgrErrorCode.RESULT_REJECTED, message, cause);
    this.reason = reason;
    withContext("reason", reason.name());
  }

  public Reason getReason() {
    return reason;
  }
}
