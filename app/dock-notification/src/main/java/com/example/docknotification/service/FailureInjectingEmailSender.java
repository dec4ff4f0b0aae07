/*
 * Where: Dock notification service layer
 * What: CI/test-only email sender that fails for matching recipients
 * Why: Reproduce retry and dead-lettering end to end without touching the real send path
 */
package com.example.docknotification.service;

import com.example.docknotification.model.AppointmentSnapshot;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.email.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingEmailSender implements AppointmentEmailSender {

  private final LocalAppointmentEmailSender delegate;

  @Value("${notification.email.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  @Override
  public boolean sendConfirmationEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule) {
    failIfMatched(to);
    return delegate.sendConfirmationEmail(to, confirmationCode, schedule);
  }

  @Override
  public boolean sendReminderEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule, int hoursUntilAppointment) {
    failIfMatched(to);
    return delegate.sendReminderEmail(to, confirmationCode, schedule, hoursUntilAppointment);
  }

  @Override
  public boolean sendRescheduleEmail(
      String to,
      String confirmationCode,
      AppointmentSnapshot schedule,
      Instant oldStartTime,
      Instant oldEndTime) {
    failIfMatched(to);
    return delegate.sendRescheduleEmail(to, confirmationCode, schedule, oldStartTime, oldEndTime);
  }

  @Override
  public boolean sendCancellationEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule) {
    failIfMatched(to);
    return delegate.sendCancellationEmail(to, confirmationCode, schedule);
  }

  private void failIfMatched(String to) {
    if (recipientPrefix == null || recipientPrefix.isBlank() || to == null) {
      return;
    }
    if (to.startsWith(recipientPrefix)) {
      throw new IllegalStateException("email delivery failure injection matched to=" + to);
    }
  }
}
