/*
 * Where: Dock notification queue layer
 * What: Contract of one broker-backed priority queue
 * Why: Workers and the enqueue path depend on queue semantics, not on Redis commands
 */
package com.example.docknotification.queue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface NotificationQueue {

  String name();

  QueueSettings settings();

  /**
   * Adds a job to the waiting set.
   *
   * @return the broker-assigned job id
   */
  String add(String jobName, String data, int priority, String traceId, Instant now);

  /**
   * Records a failed attempt for every job active longer than the stalled timeout, promotes
   * delayed jobs that are due, then claims the highest-weight, oldest waiting job and marks it
   * active.
   */
  Optional<QueuedJob> claimNext(Instant now);

  void complete(QueuedJob job, Instant now);

  /** Records a failed attempt and applies the retry policy. */
  FailureOutcome fail(QueuedJob job, String errorMessage, Instant now);

  /** Dead-letters a job without consulting the retry policy. */
  void discard(QueuedJob job, String errorMessage, Instant now);

  QueueCounts counts();

  /** Most recently dead-lettered jobs first. */
  List<FailedJob> failedJobs(int limit);

  void close();
}
