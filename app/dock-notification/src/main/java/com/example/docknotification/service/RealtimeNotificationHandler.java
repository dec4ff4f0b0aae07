package com.example.docknotification.service;

import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.RealtimePayload;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Fans a realtime job out to the tenant's connected clients. */
@Component
@RequiredArgsConstructor
public class RealtimeNotificationHandler {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeNotificationHandler.class);

  private final TenantBroadcaster broadcaster;

  public void handle(NotificationJob job) {
    final RealtimePayload payload = job.realtimePayload();
    try {
      final int clients =
          broadcaster.broadcastToTenant(job.tenantId(), payload.eventType(), payload.data());
      logger.info(
          "realtime broadcast sent tenantId={} eventType={} clients={}",
          job.tenantId(),
          payload.eventType(),
          clients);
    } catch (RuntimeException ex) {
      logger.error(
          "realtime broadcast failed tenantId={} eventType={}",
          job.tenantId(),
          payload.eventType(),
          ex);
      throw ex;
    }
  }
}
