/*
 * Where: Dock notification configuration binding
 * What: Worker polling, stalled-job recovery and per-lane retry/retention settings
 * Why: Operators tune lanes without code changes, unset values fall back to lane defaults
 */
package com.example.docknotification.config;

import com.example.docknotification.model.Priority;
import com.example.docknotification.queue.BackoffKind;
import com.example.docknotification.queue.QueueSettings;
import com.example.docknotification.queue.RetentionPolicy;
import com.example.docknotification.queue.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.queue")
@Validated
public record NotificationQueueProperties(
    boolean workersEnabled,
    Duration pollInterval,
    Duration closeTimeout,
    Duration stalledTimeout,
    @Positive int errorMessageMaxLength,
    @Valid Lane normal,
    @Valid Lane urgent) {

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);

  public Duration resolvedPollInterval() {
    return pollInterval == null ? DEFAULT_POLL_INTERVAL : pollInterval;
  }

  public Duration resolvedCloseTimeout() {
    return closeTimeout == null ? DEFAULT_CLOSE_TIMEOUT : closeTimeout;
  }

  public Duration resolvedStalledTimeout() {
    return stalledTimeout == null ? QueueSettings.DEFAULT_STALLED_TIMEOUT : stalledTimeout;
  }

  @AssertTrue(message = "notification.queue.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return pollInterval == null || isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "notification.queue.close-timeout must be positive")
  public boolean isCloseTimeoutPositive() {
    return closeTimeout == null || isPositiveDuration(closeTimeout);
  }

  @AssertTrue(message = "notification.queue.stalled-timeout must be positive")
  public boolean isStalledTimeoutPositive() {
    return stalledTimeout == null || isPositiveDuration(stalledTimeout);
  }

  public QueueSettings toSettings(Priority priority) {
    final Lane configured = priority == Priority.URGENT ? urgent : normal;
    final Lane lane = configured == null ? Lane.UNSET : configured;
    final QueueSettings defaults = QueueSettings.defaultsFor(priority);
    final RetryPolicy defaultRetry = defaults.retryPolicy();
    final RetentionPolicy defaultRetention = defaults.retentionPolicy();
    return new QueueSettings(
        lane.name() == null || lane.name().isBlank() ? defaults.name() : lane.name(),
        priority,
        lane.concurrency() == null ? defaults.concurrency() : lane.concurrency(),
        new RetryPolicy(
            lane.attempts() == null ? defaultRetry.maxAttempts() : lane.attempts(),
            lane.backoffType() == null ? defaultRetry.backoffKind() : lane.backoffType(),
            lane.backoffDelay() == null ? defaultRetry.initialDelay() : lane.backoffDelay()),
        new RetentionPolicy(
            lane.removeOnComplete() == null
                ? defaultRetention.keepCompleted()
                : lane.removeOnComplete(),
            lane.removeOnFail() == null ? defaultRetention.keepFailed() : lane.removeOnFail()),
        resolvedStalledTimeout());
  }

  private static boolean isPositiveDuration(Duration duration) {
    return !duration.isZero() && !duration.isNegative();
  }

  /**
   * One priority lane. {@code removeOnComplete} and {@code removeOnFail} are the number of finished
   * jobs kept, the rest are deleted. {@code backoffType} is {@code exponential} or {@code fixed}.
   */
  public record Lane(
      String name,
      @Positive Integer concurrency,
      @Positive Integer attempts,
      BackoffKind backoffType,
      Duration backoffDelay,
      @PositiveOrZero Integer removeOnComplete,
      @PositiveOrZero Integer removeOnFail) {

    static final Lane UNSET = new Lane(null, null, null, null, null, null, null);

    @AssertTrue(message = "backoff-delay must not be negative")
    public boolean isBackoffDelayValid() {
      return backoffDelay == null || !backoffDelay.isNegative();
    }
  }
}
