package com.example.docknotification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.docknotification.service.DeliveryMode;
import com.example.docknotification.service.NotificationSubsystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class NotificationBrokerHealthIndicatorTest {

  @Mock private NotificationSubsystem subsystem;

  @InjectMocks private NotificationBrokerHealthIndicator indicator;

  @Test
  void directModeIsUpButDegraded() {
    when(subsystem.mode()).thenReturn(DeliveryMode.DIRECT);

    final Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails()).containsEntry("mode", "direct").containsEntry("degraded", true);
    verify(subsystem, never()).isBrokerHealthy();
  }

  @Test
  void queuedModeFollowsPing() {
    when(subsystem.mode()).thenReturn(DeliveryMode.QUEUED);
    when(subsystem.isBrokerHealthy()).thenReturn(false);

    final Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsEntry("mode", "queued");
  }
}
