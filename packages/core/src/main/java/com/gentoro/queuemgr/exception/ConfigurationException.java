package com.gentoro.queuemgr.exception;

/** Invalid or unreadable configuration. */
public class ConfigurationException extends QueueMgrException {
  public ConfigurationException(String message) {
    super(QueueMgrErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(QueueMgrErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
