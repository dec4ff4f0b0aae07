package com.example.docknotification.api;

public class QueueNotFoundException extends RuntimeException {

  public QueueNotFoundException(String queueName) {
    super("notification queue not found: " + queueName);
  }
}
