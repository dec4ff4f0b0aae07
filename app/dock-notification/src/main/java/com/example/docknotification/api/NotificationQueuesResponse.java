/*
 * Where: Dock notification API model
 * What: Delivery mode, broker health and per-queue counts
 * Why: Operators check queue state without a Redis client
 */
package com.example.docknotification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationQueuesResponse(
    String mode, boolean brokerHealthy, List<QueueCountsResponse> queues) {

  public NotificationQueuesResponse {
    if (queues != null) {
      queues = Collections.unmodifiableList(new ArrayList<>(queues));
    }
  }

  @Override
  public List<QueueCountsResponse> queues() {
    if (queues == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(queues));
  }
}
