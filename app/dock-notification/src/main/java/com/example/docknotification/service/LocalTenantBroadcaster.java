/*
 * Where: Dock notification service layer
 * What: Simulated realtime fanout
 * Why: Exercise the realtime path without a websocket hub attached
 */
package com.example.docknotification.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalTenantBroadcaster implements TenantBroadcaster {

  private static final Logger logger = LoggerFactory.getLogger(LocalTenantBroadcaster.class);

  @Override
  public int broadcastToTenant(long tenantId, String eventType, JsonNode data) {
    // no connected clients in this process
    logger.info("realtime simulated broadcast tenantId={} eventType={}", tenantId, eventType);
    return 0;
  }
}
