package com.gentoro.queuemgr.exception;

/** A component was used outside of its lifecycle (e.g. after it was closed). */
public class StateException extends QueueMgrException {
  public StateException(String message) {
    super(QueueMgrErrorCode.STATE_ERROR, message);
  }
}
