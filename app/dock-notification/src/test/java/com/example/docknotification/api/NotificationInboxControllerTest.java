package com.example.docknotification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.docknotification.model.Notification;
import com.example.docknotification.service.NotificationStore;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationInboxControllerTest {

  private static final long USER_ID = 11L;

  @Mock private NotificationStore notificationStore;

  @InjectMocks private NotificationInboxController controller;

  @Test
  void inboxReturnsStoredNotifications() {
    final Notification notification =
        new Notification(
            1L, USER_ID, "Appointment Confirmed", "confirmed", "appointment", 42L, false,
            Instant.parse("2026-03-01T00:00:00Z"));
    when(notificationStore.findByUserId(USER_ID, 50)).thenReturn(List.of(notification));

    final NotificationInboxResponse response = controller.inbox(USER_ID, 50);

    assertThat(response.userId()).isEqualTo(USER_ID);
    assertThat(response.notifications()).containsExactly(notification);
  }

  @Test
  void limitIsClamped() {
    when(notificationStore.findByUserId(USER_ID, NotificationInboxController.MAX_LIMIT))
        .thenReturn(List.of());

    controller.inbox(USER_ID, 10_000);

    verify(notificationStore).findByUserId(USER_ID, NotificationInboxController.MAX_LIMIT);
  }
}
