package com.example.docknotification.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Broker-free queue with the same retry and retention rules as {@link RedisNotificationQueue}.
 * Records every added job and every scheduled retry delay for assertions.
 */
public class InMemoryNotificationQueue implements NotificationQueue {

  private final QueueSettings settings;
  private final Map<String, QueuedJob> jobs = new HashMap<>();
  private final List<Entry> waiting = new ArrayList<>();
  private final List<Entry> delayed = new ArrayList<>();
  private final Map<String, Instant> active = new HashMap<>();
  private final Deque<String> completed = new ArrayDeque<>();
  private final Deque<FailedJob> failed = new ArrayDeque<>();
  private final List<QueuedJob> added = new ArrayList<>();
  private final List<Duration> retryDelays = new ArrayList<>();
  private long sequence;
  private boolean closed;

  public InMemoryNotificationQueue(QueueSettings settings) {
    this.settings = settings;
  }

  @Override
  public String name() {
    return settings.name();
  }

  @Override
  public QueueSettings settings() {
    return settings;
  }

  @Override
  public synchronized String add(
      String jobName, String data, int priority, String traceId, Instant now) {
    if (closed) {
      throw new IllegalStateException("queue is closed: " + name());
    }
    final String id = UUID.randomUUID().toString();
    final QueuedJob job = new QueuedJob(id, name(), jobName, data, priority, 0, now, traceId);
    jobs.put(id, job);
    added.add(job);
    waiting.add(new Entry(id, priority, now, sequence++));
    return id;
  }

  @Override
  public synchronized Optional<QueuedJob> claimNext(Instant now) {
    final Instant cutoff = now.minus(settings.stalledTimeout());
    final Iterator<Map.Entry<String, Instant>> claimed = active.entrySet().iterator();
    while (claimed.hasNext()) {
      final Map.Entry<String, Instant> entry = claimed.next();
      if (!entry.getValue().isAfter(cutoff)) {
        claimed.remove();
        final QueuedJob stalled = jobs.get(entry.getKey());
        if (stalled != null) {
          recordFailedAttempt(
              stalled,
              "job stalled: no outcome recorded within " + settings.stalledTimeout(),
              now);
        }
      }
    }
    final Iterator<Entry> due = delayed.iterator();
    while (due.hasNext()) {
      final Entry entry = due.next();
      if (!entry.at().isAfter(now)) {
        due.remove();
        waiting.add(entry);
      }
    }
    final Optional<Entry> next =
        waiting.stream()
            .min(
                Comparator.comparingInt((Entry e) -> -e.priority())
                    .thenComparing(Entry::at)
                    .thenComparingLong(Entry::sequence));
    if (next.isEmpty()) {
      return Optional.empty();
    }
    waiting.remove(next.get());
    active.put(next.get().id(), now);
    return Optional.of(jobs.get(next.get().id()));
  }

  @Override
  public synchronized void complete(QueuedJob job, Instant now) {
    active.remove(job.id());
    completed.addFirst(job.id());
    while (completed.size() > settings.retentionPolicy().keepCompleted()) {
      jobs.remove(completed.removeLast());
    }
  }

  @Override
  public synchronized FailureOutcome fail(QueuedJob job, String errorMessage, Instant now) {
    active.remove(job.id());
    return recordFailedAttempt(job, errorMessage, now);
  }

  private FailureOutcome recordFailedAttempt(QueuedJob job, String errorMessage, Instant now) {
    final int attemptsMade = job.attemptsMade() + 1;
    final QueuedJob updated =
        new QueuedJob(
            job.id(),
            job.queueName(),
            job.name(),
            job.data(),
            job.priority(),
            attemptsMade,
            job.enqueuedAt(),
            job.traceId());
    jobs.put(job.id(), updated);
    if (settings.retryPolicy().shouldRetry(attemptsMade)) {
      final Duration delay = settings.retryPolicy().delayAfter(attemptsMade);
      retryDelays.add(delay);
      delayed.add(new Entry(job.id(), job.priority(), now.plus(delay), sequence++));
      return FailureOutcome.retry(attemptsMade, delay);
    }
    deadLetter(updated, attemptsMade, errorMessage, now);
    return FailureOutcome.deadLettered(attemptsMade);
  }

  @Override
  public synchronized void discard(QueuedJob job, String errorMessage, Instant now) {
    active.remove(job.id());
    deadLetter(job, job.attemptsMade() + 1, errorMessage, now);
  }

  @Override
  public synchronized QueueCounts counts() {
    return new QueueCounts(
        waiting.size(), delayed.size(), active.size(), completed.size(), failed.size());
  }

  @Override
  public synchronized List<FailedJob> failedJobs(int limit) {
    return failed.stream().limit(limit).toList();
  }

  @Override
  public synchronized void close() {
    closed = true;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public synchronized List<QueuedJob> added() {
    return List.copyOf(added);
  }

  public synchronized List<Duration> retryDelays() {
    return List.copyOf(retryDelays);
  }

  private void deadLetter(QueuedJob job, int attemptsMade, String errorMessage, Instant now) {
    failed.addFirst(
        new FailedJob(job.id(), job.name(), job.data(), attemptsMade, errorMessage, now));
    while (failed.size() > settings.retentionPolicy().keepFailed()) {
      jobs.remove(failed.removeLast().id());
    }
  }

  private record Entry(String id, int priority, Instant at, long sequence) {}
}
