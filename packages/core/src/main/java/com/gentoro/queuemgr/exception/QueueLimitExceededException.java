package com.gentoro.queuemgr.exception;

/** A queue size limit is reached and no terminal record is available for eviction. */
public class QueueLimitExceededException extends QueueMgrException {
  public QueueLimitExceededException(String message) {
    super(QueueMgrErrorCode.QUEUE_LIMIT_EXCEEDED, message);
  }
}
