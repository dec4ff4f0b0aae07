package com.example.docknotification.queue;

public record QueueCounts(long waiting, long delayed, long active, long completed, long failed) {

  /** Jobs not yet finished and not currently running. */
  public long backlog() {
    return waiting + delayed;
  }
}
