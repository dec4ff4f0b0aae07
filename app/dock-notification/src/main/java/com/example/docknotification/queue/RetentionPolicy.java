package com.example.docknotification.queue;

/** How many finished job records a queue keeps in the broker. */
public record RetentionPolicy(int keepCompleted, int keepFailed) {

  public RetentionPolicy {
    if (keepCompleted < 0 || keepFailed < 0) {
      throw new IllegalArgumentException(
          "retention counts must not be negative: completed=" + keepCompleted + " failed=" + keepFailed);
    }
  }
}
