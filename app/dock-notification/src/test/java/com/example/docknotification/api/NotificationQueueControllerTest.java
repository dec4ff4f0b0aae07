package com.example.docknotification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.docknotification.model.Priority;
import com.example.docknotification.queue.InMemoryNotificationQueue;
import com.example.docknotification.queue.QueuePair;
import com.example.docknotification.queue.QueueSettings;
import com.example.docknotification.queue.QueuedJob;
import com.example.docknotification.service.DeliveryMode;
import com.example.docknotification.service.NotificationSubsystem;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationQueueControllerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private NotificationSubsystem subsystem;

  @InjectMocks private NotificationQueueController controller;

  @Test
  void directModeReportsNoQueues() {
    when(subsystem.queues()).thenReturn(Optional.empty());
    when(subsystem.mode()).thenReturn(DeliveryMode.DIRECT);

    final NotificationQueuesResponse response = controller.queues();

    assertThat(response.mode()).isEqualTo("direct");
    assertThat(response.brokerHealthy()).isFalse();
    assertThat(response.queues()).isEmpty();
  }

  @Test
  void queuedModeReportsCountsPerLane() {
    final QueuePair queues = queues();
    queues.normal().add("email-notification", "{}", 5, "trace-1", FIXED_NOW);
    when(subsystem.queues()).thenReturn(Optional.of(queues));
    when(subsystem.mode()).thenReturn(DeliveryMode.QUEUED);
    when(subsystem.isBrokerHealthy()).thenReturn(true);

    final NotificationQueuesResponse response = controller.queues();

    assertThat(response.mode()).isEqualTo("queued");
    assertThat(response.brokerHealthy()).isTrue();
    assertThat(response.queues())
        .containsExactly(
            new QueueCountsResponse(QueueSettings.NORMAL_QUEUE_NAME, 1, 0, 0, 0, 0),
            new QueueCountsResponse(QueueSettings.URGENT_QUEUE_NAME, 0, 0, 0, 0, 0));
  }

  @Test
  void failedJobsAreListedWithReason() {
    final QueuePair queues = queues();
    queues.urgent().add("realtime-notification", "{broken", 10, "trace-1", FIXED_NOW);
    final QueuedJob claimed = queues.urgent().claimNext(FIXED_NOW).orElseThrow();
    queues.urgent().discard(claimed, "undecodable", FIXED_NOW);
    when(subsystem.queues()).thenReturn(Optional.of(queues));

    final FailedJobsResponse response = controller.failed(QueueSettings.URGENT_QUEUE_NAME, 500);

    assertThat(response.queue()).isEqualTo(QueueSettings.URGENT_QUEUE_NAME);
    assertThat(response.jobs()).hasSize(1);
    final FailedJobSummary summary = response.jobs().get(0);
    assertThat(summary.id()).isEqualTo(claimed.id());
    assertThat(summary.name()).isEqualTo("realtime-notification");
    assertThat(summary.reason()).isEqualTo("undecodable");
    assertThat(summary.data()).isEqualTo("{broken");
  }

  @Test
  void unknownQueueIsNotFound() {
    when(subsystem.queues()).thenReturn(Optional.of(queues()));

    assertThatThrownBy(() -> controller.failed("missing", 20))
        .isInstanceOf(QueueNotFoundException.class);
  }

  @Test
  void directModeHasNoFailedJobs() {
    when(subsystem.queues()).thenReturn(Optional.empty());

    assertThatThrownBy(() -> controller.failed(QueueSettings.NORMAL_QUEUE_NAME, 20))
        .isInstanceOf(QueueNotFoundException.class);
  }

  private static QueuePair queues() {
    return new QueuePair(
        new InMemoryNotificationQueue(QueueSettings.defaultsFor(Priority.NORMAL)),
        new InMemoryNotificationQueue(QueueSettings.defaultsFor(Priority.URGENT)));
  }
}
