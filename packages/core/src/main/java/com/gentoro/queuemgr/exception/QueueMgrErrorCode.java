package com.gentoro.queuemgr.exception;

/** Stable error codes reported alongside every {@link QueueMgrException}. */
public enum QueueMgrErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  DUPLICATE_JOB_ID,
  NOT_FOUND,
  INVALID_TRANSITION,
  JOB_NOT_TERMINAL,
  RESULT_REJECTED,
  DECODE_ERROR,
  STORAGE_ERROR,
  QUEUE_LIMIT_EXCEEDED,
  STATE_ERROR
}
