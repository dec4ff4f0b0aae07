package com.example.docknotification.service;

import com.fasterxml.jackson.databind.JsonNode;

/** Pushes an event to every realtime client of a tenant. */
public interface TenantBroadcaster {

  /**
   * @return number of clients the event reached, zero is a valid outcome
   */
  int broadcastToTenant(long tenantId, String eventType, JsonNode data);
}
