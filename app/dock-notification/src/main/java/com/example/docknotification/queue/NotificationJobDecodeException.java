package com.example.docknotification.queue;

/** Job body could not be turned back into a notification job. Retrying will not help. */
public class NotificationJobDecodeException extends RuntimeException {

  public NotificationJobDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
