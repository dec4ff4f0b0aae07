/*
 * Where: Dock notification service layer
 * What: Places jobs on the queue matching their priority
 * Why: Delivery happens later on worker threads with retries
 */
package com.example.docknotification.service;

import com.example.common.TraceIds;
import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.Priority;
import com.example.docknotification.queue.NotificationJobCodec;
import com.example.docknotification.queue.NotificationQueue;
import com.example.docknotification.queue.QueuePair;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QueuedDeliveryStrategy implements DeliveryStrategy {

  private static final Logger logger = LoggerFactory.getLogger(QueuedDeliveryStrategy.class);

  private final QueuePair queues;
  private final NotificationJobCodec codec;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public QueuedDeliveryStrategy(
      QueuePair queues, NotificationJobCodec codec, NotificationMetrics metrics, Clock clock) {
    this.queues = queues;
    this.codec = codec;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public DeliveryMode mode() {
    return DeliveryMode.QUEUED;
  }

  /** Broker failures propagate to the caller. */
  @Override
  public String submit(NotificationJob job, Priority priority) {
    final NotificationQueue queue = queues.forPriority(priority);
    final String jobId =
        queue.add(
            job.kind().jobName(),
            codec.encode(job),
            priority.weight(),
            TraceIds.currentOrNew(),
            clock.instant());
    metrics.recordEnqueued(mode().value(), job.kind().value(), priority.value());
    logger.info(
        "notification job enqueued jobId={} queue={} tenantId={} kind={} priority={}",
        jobId,
        queue.name(),
        job.tenantId(),
        job.kind().value(),
        priority.weight());
    return jobId;
  }
}
