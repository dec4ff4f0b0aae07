package com.example.docknotification.service;

public enum DeliveryMode {
  /** Jobs go through the broker-backed queues and are executed by workers. */
  QUEUED("queued"),
  /** No broker configured: jobs run inline on the caller's thread. */
  DIRECT("direct");

  private final String value;

  DeliveryMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
