package com.example.docknotification.queue;

import java.time.Duration;

/** What a queue did with a failed job. {@code delay} is null once the job is dead-lettered. */
public record FailureOutcome(boolean retryScheduled, int attemptsMade, Duration delay) {

  public static FailureOutcome retry(int attemptsMade, Duration delay) {
    return new FailureOutcome(true, attemptsMade, delay);
  }

  public static FailureOutcome deadLettered(int attemptsMade) {
    return new FailureOutcome(false, attemptsMade, null);
  }
}
