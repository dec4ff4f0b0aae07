/*
 * Where: Dock notification queue layer
 * What: Per-queue retry budget and backoff curve
 * Why: Keep retry behaviour an explicit value that tests can reason about without a broker
 */
package com.example.docknotification.queue;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int maxAttempts, BackoffKind backoffKind, Duration initialDelay) {

  // 2^30 times any sane delay is already far beyond a retention window
  private static final int MAX_SHIFT = 30;

  public RetryPolicy {
    Objects.requireNonNull(backoffKind, "backoffKind");
    Objects.requireNonNull(initialDelay, "initialDelay");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must not be negative: " + initialDelay);
    }
  }

  public static RetryPolicy exponential(int maxAttempts, Duration initialDelay) {
    return new RetryPolicy(maxAttempts, BackoffKind.EXPONENTIAL, initialDelay);
  }

  /** Whether a job that has failed {@code attemptsMade} times gets another attempt. */
  public boolean shouldRetry(int attemptsMade) {
    return attemptsMade < maxAttempts;
  }

  /**
   * Delay before the next attempt of a job that has failed {@code attemptsMade} times.
   * Exponential backoff doubles from {@link #initialDelay()}: 1x after the first failure, 2x after
   * the second, and so on.
   */
  public Duration delayAfter(int attemptsMade) {
    if (attemptsMade < 1) {
      throw new IllegalArgumentException("attemptsMade must be at least 1: " + attemptsMade);
    }
    if (backoffKind == BackoffKind.FIXED) {
      return initialDelay;
    }
    final int shift = Math.min(attemptsMade - 1, MAX_SHIFT);
    return initialDelay.multipliedBy(1L << shift);
  }
}
