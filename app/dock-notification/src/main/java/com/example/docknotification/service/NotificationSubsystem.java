/*
 * Where: Dock notification service layer
 * What: Owns the broker connection, queues, workers and the delivery strategy
 * Why: Everything is decided once at startup and torn down in a fixed order on shutdown
 */
package com.example.docknotification.service;

import com.example.docknotification.broker.BrokerConnection;
import com.example.docknotification.config.NotificationQueueProperties;
import com.example.docknotification.model.Priority;
import com.example.docknotification.queue.NotificationJobCodec;
import com.example.docknotification.queue.NotificationQueue;
import com.example.docknotification.queue.QueuePair;
import com.example.docknotification.queue.RedisNotificationQueue;
import com.example.docknotification.worker.NotificationQueueWorker;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

public class NotificationSubsystem {

  private static final Logger logger = LoggerFactory.getLogger(NotificationSubsystem.class);

  private final BrokerConnection broker;
  private final QueuePair queues;
  private final NotificationQueueWorker normalWorker;
  private final NotificationQueueWorker urgentWorker;
  private final DeliveryStrategy deliveryStrategy;
  private final AtomicBoolean shutDown = new AtomicBoolean(false);

  NotificationSubsystem(
      BrokerConnection broker,
      QueuePair queues,
      NotificationQueueWorker normalWorker,
      NotificationQueueWorker urgentWorker,
      DeliveryStrategy deliveryStrategy) {
    this.broker = broker;
    this.queues = queues;
    this.normalWorker = normalWorker;
    this.urgentWorker = urgentWorker;
    this.deliveryStrategy = deliveryStrategy;
  }

  /**
   * Builds the queued subsystem when the broker is configured, the inline one otherwise. Workers
   * start immediately when enabled.
   */
  public static NotificationSubsystem create(
      BrokerConnection broker,
      NotificationQueueProperties properties,
      NotificationJobCodec codec,
      NotificationDispatcher dispatcher,
      NotificationMetrics metrics,
      Clock clock) {
    final Optional<StringRedisTemplate> connection = broker.getConnection();
    if (connection.isEmpty()) {
      logger.info("notification broker not configured, delivering inline mode=direct");
      return new NotificationSubsystem(
          broker, null, null, null, new DirectDeliveryStrategy(dispatcher, metrics));
    }

    final StringRedisTemplate template = connection.get();
    final QueuePair queues =
        new QueuePair(
            new RedisNotificationQueue(
                template, properties.toSettings(Priority.NORMAL), properties.errorMessageMaxLength()),
            new RedisNotificationQueue(
                template, properties.toSettings(Priority.URGENT), properties.errorMessageMaxLength()));

    NotificationQueueWorker normalWorker = null;
    NotificationQueueWorker urgentWorker = null;
    if (properties.workersEnabled()) {
      normalWorker = newWorker(queues.normal(), properties, codec, dispatcher, metrics, clock);
      urgentWorker = newWorker(queues.urgent(), properties, codec, dispatcher, metrics, clock);
      normalWorker.start();
      urgentWorker.start();
    } else {
      logger.info("notification workers disabled, jobs are only enqueued");
    }

    logger.info(
        "notification delivery ready mode=queued queues={},{}",
        queues.normal().name(),
        queues.urgent().name());
    return new NotificationSubsystem(
        broker,
        queues,
        normalWorker,
        urgentWorker,
        new QueuedDeliveryStrategy(queues, codec, metrics, clock));
  }

  private static NotificationQueueWorker newWorker(
      NotificationQueue queue,
      NotificationQueueProperties properties,
      NotificationJobCodec codec,
      NotificationDispatcher dispatcher,
      NotificationMetrics metrics,
      Clock clock) {
    return new NotificationQueueWorker(
        queue,
        codec,
        dispatcher,
        metrics,
        clock,
        properties.resolvedPollInterval(),
        properties.resolvedCloseTimeout());
  }

  public DeliveryStrategy deliveryStrategy() {
    return deliveryStrategy;
  }

  public DeliveryMode mode() {
    return deliveryStrategy.mode();
  }

  /** Empty in direct mode. */
  public Optional<QueuePair> queues() {
    return Optional.ofNullable(queues);
  }

  public boolean isBrokerHealthy() {
    return broker.healthCheck();
  }

  public boolean isShutDown() {
    return shutDown.get();
  }

  /**
   * Closes the normal worker, the urgent worker, the normal queue, the urgent queue and then the
   * broker. Each step is skipped when absent and logged when it fails. Safe to call twice.
   */
  public void shutdown() {
    if (!shutDown.compareAndSet(false, true)) {
      return;
    }
    logger.info("notification subsystem shutting down mode={}", mode().value());
    if (normalWorker != null) {
      runStep("normal worker", normalWorker::close);
    }
    if (urgentWorker != null) {
      runStep("urgent worker", urgentWorker::close);
    }
    if (queues != null) {
      runStep("normal queue", queues.normal()::close);
      runStep("urgent queue", queues.urgent()::close);
    }
    if (broker != null) {
      runStep("broker connection", broker::shutdown);
    }
    logger.info("notification subsystem shut down");
  }

  private void runStep(String step, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      logger.error("notification shutdown step failed step={}", step, ex);
    }
  }
}
