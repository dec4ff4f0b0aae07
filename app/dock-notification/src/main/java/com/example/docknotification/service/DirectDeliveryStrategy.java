package com.example.docknotification.service;

import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.Priority;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the handler on the caller's thread. Used when no broker is configured; there is no retry
 * and the handler's exception reaches the caller.
 */
public class DirectDeliveryStrategy implements DeliveryStrategy {

  private static final Logger logger = LoggerFactory.getLogger(DirectDeliveryStrategy.class);

  static final String JOB_ID_PREFIX = "direct-";

  private final NotificationDispatcher dispatcher;
  private final NotificationMetrics metrics;

  public DirectDeliveryStrategy(NotificationDispatcher dispatcher, NotificationMetrics metrics) {
    this.dispatcher = dispatcher;
    this.metrics = metrics;
  }

  @Override
  public DeliveryMode mode() {
    return DeliveryMode.DIRECT;
  }

  @Override
  public String submit(NotificationJob job, Priority priority) {
    final String jobId = JOB_ID_PREFIX + UUID.randomUUID();
    metrics.recordEnqueued(mode().value(), job.kind().value(), priority.value());
    logger.debug(
        "notification delivered inline jobId={} tenantId={} kind={}",
        jobId,
        job.tenantId(),
        job.kind().value());
    dispatcher.dispatch(jobId, job);
    return jobId;
  }
}
