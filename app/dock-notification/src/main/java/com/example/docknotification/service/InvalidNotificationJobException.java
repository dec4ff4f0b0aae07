package com.example.docknotification.service;

/** A decoded job is missing data its handler needs. The job fails and is retried. */
public class InvalidNotificationJobException extends RuntimeException {

  public InvalidNotificationJobException(String message) {
    super(message);
  }
}
