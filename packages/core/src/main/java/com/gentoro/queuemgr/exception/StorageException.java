package com.gentoro.queuemgr.exception;

/** Underlying file I/O failed. Fatal for the operation that raised it. */
public class StorageException extends QueueMgrException {
  public StorageException(String message) {
    super(QueueMgrErrorCode.STORAGE_ERROR, message);
  }

  public StorageException(String message, Throwable cause) {
    super(QueueMgrErrorCode.STORAGE_ERROR, message, cause);
  }
}
