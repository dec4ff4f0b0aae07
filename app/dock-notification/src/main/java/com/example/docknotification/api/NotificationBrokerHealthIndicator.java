/*
 * Where: Dock notification actuator health
 * What: Reports the delivery mode and the broker ping
 * Why: Inline delivery is a healthy, if degraded, state and must not show as DOWN
 */
package com.example.docknotification.api;

import com.example.docknotification.service.DeliveryMode;
import com.example.docknotification.service.NotificationSubsystem;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("notificationBroker")
@RequiredArgsConstructor
public class NotificationBrokerHealthIndicator implements HealthIndicator {

  private final NotificationSubsystem subsystem;

  @Override
  public Health health() {
    final DeliveryMode mode = subsystem.mode();
    if (mode == DeliveryMode.DIRECT) {
      return Health.up().withDetail("mode", mode.value()).withDetail("degraded", true).build();
    }
    final Health.Builder builder = subsystem.isBrokerHealthy() ? Health.up() : Health.down();
    return builder.withDetail("mode", mode.value()).build();
  }
}
