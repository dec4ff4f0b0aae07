package com.example.docknotification.service;

import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.PushPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mobile push extension point. No provider is attached, so jobs are logged and complete
 * successfully.
 */
@Component
public class PushNotificationHandler {

  private static final Logger logger = LoggerFactory.getLogger(PushNotificationHandler.class);

  public void handle(NotificationJob job) {
    final PushPayload payload = job.pushPayload();
    logger.info(
        "push notification not delivered, no provider tenantId={} userId={} title={}",
        job.tenantId(),
        job.userId(),
        payload.title());
  }
}
