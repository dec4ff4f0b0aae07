package com.example.docknotification.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.docknotification.TestAppointments;
import com.example.docknotification.model.EmailPayload;
import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.PushPayload;
import com.example.docknotification.model.RealtimePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

  @Mock private EmailNotificationHandler emailHandler;
  @Mock private RealtimeNotificationHandler realtimeHandler;
  @Mock private PushNotificationHandler pushHandler;

  private NotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = new NotificationDispatcher(emailHandler, realtimeHandler, pushHandler);
  }

  @Test
  void emailJobGoesToEmailHandlerOnly() {
    final NotificationJob job =
        NotificationJob.email(
            1L,
            EmailPayload.confirmation(
                TestAppointments.DRIVER_EMAIL, "C", TestAppointments.scheduled()));

    dispatcher.dispatch("job-1", job);

    verify(emailHandler).handle(job);
    verifyNoInteractions(realtimeHandler, pushHandler);
  }

  @Test
  void realtimeJobGoesToRealtimeHandlerOnly() {
    final NotificationJob job =
        NotificationJob.realtime(1L, null, null, new RealtimePayload("x", null));

    dispatcher.dispatch("job-2", job);

    verify(realtimeHandler).handle(job);
    verifyNoInteractions(emailHandler, pushHandler);
  }

  @Test
  void pushJobGoesToPushHandlerOnly() {
    final NotificationJob job = NotificationJob.push(1L, 5L, new PushPayload("t", "m", null));

    dispatcher.dispatch("job-3", job);

    verify(pushHandler).handle(job);
    verifyNoInteractions(emailHandler, realtimeHandler);
  }

  @Test
  void handlerExceptionPropagatesUnchanged() {
    final InvalidNotificationJobException failure = new InvalidNotificationJobException("bad");
    doThrow(failure).when(realtimeHandler).handle(any());

    assertThatThrownBy(
            () ->
                dispatcher.dispatch(
                    "job-4",
                    NotificationJob.realtime(1L, null, null, new RealtimePayload("x", null))))
        .isSameAs(failure);
  }
}
