/*
 * Where: Dock notification service layer
 * What: Routes a job to the handler of its kind
 * Why: Queued and direct delivery share one execution path
 */
package com.example.docknotification.service;

import com.example.docknotification.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final EmailNotificationHandler emailHandler;
  private final RealtimeNotificationHandler realtimeHandler;
  private final PushNotificationHandler pushHandler;

  /** Handler exceptions propagate unchanged. */
  public void dispatch(String jobId, NotificationJob job) {
    logger.info(
        "notification job started jobId={} tenantId={} kind={}",
        jobId,
        job.tenantId(),
        job.kind().value());
    switch (job.kind()) {
      case EMAIL -> emailHandler.handle(job);
      case REALTIME -> realtimeHandler.handle(job);
      case PUSH -> pushHandler.handle(job);
      default -> throw new IllegalArgumentException(
          "unsupported notification kind: " + job.kind().value());
    }
    logger.info(
        "notification job finished jobId={} tenantId={} kind={}",
        jobId,
        job.tenantId(),
        job.kind().value());
  }
}
