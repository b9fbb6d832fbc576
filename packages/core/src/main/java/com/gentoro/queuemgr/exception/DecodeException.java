package com.gentoro.queuemgr.exception;

/**
 * A persisted registry line could not be turned into a record.
 *
 * <p>{@link Kind#CORRUPT} means the text is truncated or not well-formed; a trailing corrupt line
 * is the footprint of an interrupted append and may be discarded. {@link Kind#INVALID} means the
 * line parsed but violates a record invariant; it is fatal for that record only.
 */
public class DecodeException extends QueueMgrException {

  public enum Kind {
    CORRUPT,
    INVALID
  }

  private final Kind kind;
  private long lineNumber = -1;

  public DecodeException(Kind kind, String message) {
    super(QueueMgrErrorCode.DECODE_ERROR, message);
    this.kind = kind;
    withContext("kind", kind.name());
  }

  public DecodeException(Kind kind, String message, Throwable cause) {
    super(QueueMgrErrorCode.DECODE_ERROR, message, cause);
    this.kind = kind;
    withContext("kind", kind.name());
  }

  public Kind getKind() {
    return kind;
  }

  /** 1-based line number within the registry file, or -1 when decoded outside of a file scan. */
  public long getLineNumber() {
    return lineNumber;
  }

  public DecodeException atLine(long lineNumber) {
    this.lineNumber = lineNumber;
    withContext("line", lineNumber);
    return this;
  }
}
