/*
 * Where: Dock notification service layer
 * What: Records enqueue, job outcome, end-to-end delay, backlog and dead-letter metrics
 * Why: Queue health has to be visible from Prometheus without opening the broker
 */
package com.example.docknotification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  static final String METRIC_ENQUEUED_TOTAL = "notification.job.enqueued.total";
  static final String METRIC_JOB_TOTAL = "notification.job.total";
  static final String METRIC_JOB_E2E_DELAY = "notification.job.e2e.delay";
  static final String METRIC_BACKLOG_CURRENT = "notification.queue.backlog.current";
  static final String METRIC_DLQ_TOTAL = "notification.dlq.total";

  public static final String RESULT_COMPLETED = "completed";
  public static final String RESULT_RETRY = "retry";
  public static final String RESULT_DEAD_LETTERED = "dead_lettered";
  public static final String RESULT_DISCARDED = "discarded";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> enqueuedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> jobCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dlqCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> e2eTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> backlogs = new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordEnqueued(String mode, String kind, String priority) {
    enqueuedCounters
        .computeIfAbsent(
            mode + "|" + kind + "|" + priority,
            ignored ->
                Counter.builder(METRIC_ENQUEUED_TOTAL)
                    .description("Notification jobs accepted for delivery")
                    .tags(Tags.of("mode", mode, "kind", kind, "priority", priority))
                    .register(meterRegistry))
        .increment();
  }

  public void recordJobResult(String queue, String result) {
    jobCounters
        .computeIfAbsent(
            queue + "|" + result,
            ignored ->
                Counter.builder(METRIC_JOB_TOTAL)
                    .description("Notification job outcomes")
                    .tags(Tags.of("queue", queue, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeadLettered(String queue) {
    dlqCounters
        .computeIfAbsent(
            queue,
            ignored ->
                Counter.builder(METRIC_DLQ_TOTAL)
                    .description("Notification jobs moved to the failed set")
                    .tags(Tags.of("queue", queue))
                    .register(meterRegistry))
        .increment();
  }

  public void recordE2eDelay(String queue, Instant enqueuedAt, Instant completedAt) {
    if (enqueuedAt == null || completedAt == null || completedAt.isBefore(enqueuedAt)) {
      return;
    }
    e2eTimers
        .computeIfAbsent(
            queue,
            ignored ->
                Timer.builder(METRIC_JOB_E2E_DELAY)
                    .description("Delay from enqueue to successful completion")
                    .tags(Tags.of("queue", queue))
                    .register(meterRegistry))
        .record(Duration.between(enqueuedAt, completedAt));
  }

  public void updateBacklog(String queue, long backlog) {
    backlogs
        .computeIfAbsent(
            queue,
            ignored -> {
              final AtomicLong holder = new AtomicLong();
              Gauge.builder(METRIC_BACKLOG_CURRENT, holder, AtomicLong::get)
                  .description("Waiting plus delayed jobs")
                  .tags(Tags.of("queue", queue))
                  .register(meterRegistry);
              return holder;
            })
        .set(Math.max(backlog, 0));
  }
}
