/*
 * Where: Dock notification worker layer
 * What: Claims jobs from one queue and runs them on a bounded pool
 * Why: Each lane has its own concurrency cap and a failing job must never stop the loop
 */
package com.example.docknotification.worker;

import com.example.common.TraceIds;
import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.queue.FailureOutcome;
import com.example.docknotification.queue.NotificationJobCodec;
import com.example.docknotification.queue.NotificationJobDecodeException;
import com.example.docknotification.queue.NotificationQueue;
import com.example.docknotification.queue.QueuedJob;
import com.example.docknotification.service.NotificationDispatcher;
import com.example.docknotification.service.NotificationMetrics;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class NotificationQueueWorker implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueWorker.class);

  static final String MDC_JOB_ID = "job_id";
  static final String MDC_TENANT_ID = "tenant_id";
  static final String MDC_QUEUE = "queue";

  private final NotificationQueue queue;
  private final NotificationJobCodec codec;
  private final NotificationDispatcher dispatcher;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final Duration pollInterval;
  private final Duration closeTimeout;
  private final Semaphore permits;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private ExecutorService executor;
  private Thread poller;

  public NotificationQueueWorker(
      NotificationQueue queue,
      NotificationJobCodec codec,
      NotificationDispatcher dispatcher,
      NotificationMetrics metrics,
      Clock clock,
      Duration pollInterval,
      Duration closeTimeout) {
    this.queue = queue;
    this.codec = codec;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
    this.clock = clock;
    this.pollInterval = pollInterval;
    this.closeTimeout = closeTimeout;
    this.permits = new Semaphore(queue.settings().concurrency());
  }

  public String queueName() {
    return queue.name();
  }

  public boolean isRunning() {
    return running.get();
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    final int concurrency = queue.settings().concurrency();
    executor =
        Executors.newFixedThreadPool(
            concurrency,
            new ThreadFactoryBuilder()
                .setNameFormat("notification-" + queue.name() + "-%d")
                .setDaemon(true)
                .build());
    poller = new Thread(this::pollLoop, "notification-" + queue.name() + "-poller");
    poller.setDaemon(true);
    poller.start();
    logger.info(
        "notification worker started queue={} concurrency={} pollInterval={}",
        queue.name(),
        concurrency,
        pollInterval);
  }

  /** Stops claiming and waits up to the close timeout for running jobs. Jobs are not requeued. */
  @Override
  public synchronized void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    poller.interrupt();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn(
            "notification worker close timed out queue={} timeout={}", queue.name(), closeTimeout);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    logger.info("notification worker closed queue={}", queue.name());
  }

  private void pollLoop() {
    while (running.get()) {
      final boolean claimed;
      try {
        claimed = pollOnce();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
      if (!claimed) {
        try {
          Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  /**
   * Takes a permit, claims one job and hands it to the pool.
   *
   * @return whether a job was handed off
   */
  @VisibleForTesting
  boolean pollOnce() throws InterruptedException {
    permits.acquire();
    final Optional<QueuedJob> claimed;
    try {
      claimed = queue.claimNext(clock.instant());
      if (claimed.isEmpty()) {
        metrics.updateBacklog(queue.name(), queue.counts().backlog());
      }
    } catch (RuntimeException ex) {
      permits.release();
      logger.warn("notification queue poll failed queue={}", queue.name(), ex);
      return false;
    }
    if (claimed.isEmpty()) {
      permits.release();
      return false;
    }
    final QueuedJob job = claimed.get();
    try {
      executor.execute(
          () -> {
            try {
              execute(job);
            } finally {
              permits.release();
            }
          });
    } catch (RejectedExecutionException ex) {
      permits.release();
      logger.warn(
          "notification job left active, worker closing queue={} jobId={}", queue.name(), job.id());
      return false;
    }
    return true;
  }

  /** Claims and runs one job on the calling thread. */
  @VisibleForTesting
  public boolean processNext() {
    final Optional<QueuedJob> claimed = queue.claimNext(clock.instant());
    if (claimed.isEmpty()) {
      return false;
    }
    execute(claimed.get());
    return true;
  }

  @VisibleForTesting
  void execute(QueuedJob queued) {
    final Map<String, String> previousContext = MDC.getCopyOfContextMap();
    MDC.put(MDC_JOB_ID, queued.id());
    MDC.put(MDC_QUEUE, queue.name());
    if (queued.traceId() != null) {
      MDC.put(TraceIds.MDC_KEY, queued.traceId());
    }
    try {
      final NotificationJob job;
      try {
        job = codec.decode(queued.data());
      } catch (NotificationJobDecodeException ex) {
        logger.error(
            "notification job undecodable, dead-lettering queue={} jobId={}",
            queue.name(),
            queued.id(),
            ex);
        queue.discard(queued, errorMessage(ex), clock.instant());
        metrics.recordJobResult(queue.name(), NotificationMetrics.RESULT_DISCARDED);
        metrics.recordDeadLettered(queue.name());
        return;
      }
      MDC.put(MDC_TENANT_ID, Long.toString(job.tenantId()));

      try {
        dispatcher.dispatch(queued.id(), job);
      } catch (RuntimeException ex) {
        recordFailure(queued, ex);
        return;
      }
      final Instant completedAt = clock.instant();
      queue.complete(queued, completedAt);
      metrics.recordJobResult(queue.name(), NotificationMetrics.RESULT_COMPLETED);
      metrics.recordE2eDelay(queue.name(), queued.enqueuedAt(), completedAt);
    } catch (RuntimeException ex) {
      // left in the active set; the stalled sweep counts it as a failed attempt after the timeout
      logger.warn(
          "notification job outcome not recorded queue={} jobId={} stalledTimeout={}",
          queue.name(),
          queued.id(),
          queue.settings().stalledTimeout(),
          ex);
    } finally {
      if (previousContext == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previousContext);
      }
    }
  }

  private void recordFailure(QueuedJob queued, RuntimeException ex) {
    final FailureOutcome outcome = queue.fail(queued, errorMessage(ex), clock.instant());
    if (outcome.retryScheduled()) {
      logger.warn(
          "notification job failed, retry scheduled queue={} jobId={} attempt={} delayMs={}",
          queue.name(),
          queued.id(),
          outcome.attemptsMade(),
          outcome.delay().toMillis(),
          ex);
      metrics.recordJobResult(queue.name(), NotificationMetrics.RESULT_RETRY);
      return;
    }
    logger.error(
        "notification job dead-lettered queue={} jobId={} attempts={}",
        queue.name(),
        queued.id(),
        outcome.attemptsMade(),
        ex);
    metrics.recordJobResult(queue.name(), NotificationMetrics.RESULT_DEAD_LETTERED);
    metrics.recordDeadLettered(queue.name());
  }

  private static String errorMessage(Exception ex) {
    return ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage();
  }
}
