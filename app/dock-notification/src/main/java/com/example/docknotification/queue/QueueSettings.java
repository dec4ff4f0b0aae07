/*
 * Where: Dock notification queue layer
 * What: Complete configuration of one priority lane
 * Why: Normal and urgent lanes differ in name, concurrency, retries and retention
 */
package com.example.docknotification.queue;

import com.example.docknotification.model.Priority;
import java.time.Duration;
import java.util.Objects;

public record QueueSettings(
    String name,
    Priority priority,
    int concurrency,
    RetryPolicy retryPolicy,
    RetentionPolicy retentionPolicy,
    Duration stalledTimeout) {

  public static final String NORMAL_QUEUE_NAME = "notifications";
  public static final String URGENT_QUEUE_NAME = "urgent-notifications";

  /** Claimed jobs with no recorded outcome after this long are treated as a failed attempt. */
  public static final Duration DEFAULT_STALLED_TIMEOUT = Duration.ofMinutes(5);

  public QueueSettings {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(retentionPolicy, "retentionPolicy");
    Objects.requireNonNull(stalledTimeout, "stalledTimeout");
    if (stalledTimeout.isZero() || stalledTimeout.isNegative()) {
      throw new IllegalArgumentException("stalledTimeout must be positive: " + stalledTimeout);
    }
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
    }
  }

  /** Lane defaults: normal 5 workers, 3 attempts from 2s; urgent 10 workers, 5 attempts from 1s. */
  public static QueueSettings defaultsFor(Priority priority) {
    return switch (priority) {
      case NORMAL -> new QueueSettings(
          NORMAL_QUEUE_NAME,
          Priority.NORMAL,
          5,
          RetryPolicy.exponential(3, Duration.ofMillis(2000)),
          new RetentionPolicy(100, 50),
          DEFAULT_STALLED_TIMEOUT);
      case URGENT -> new QueueSettings(
          URGENT_QUEUE_NAME,
          Priority.URGENT,
          10,
          RetryPolicy.exponential(5, Duration.ofMillis(1000)),
          new RetentionPolicy(50, 25),
          DEFAULT_STALLED_TIMEOUT);
    };
  }
}
