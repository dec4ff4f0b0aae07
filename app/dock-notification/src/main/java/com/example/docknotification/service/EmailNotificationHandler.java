/*
 * Where: Dock notification service layer
 * What: Sends exactly one appointment email variant per email job
 * Why: The variant tag decides the template, the provider failure decides the retry
 */
package com.example.docknotification.service;

import com.example.docknotification.model.AppointmentSnapshot;
import com.example.docknotification.model.EmailPayload;
import com.example.docknotification.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailNotificationHandler {

  private static final Logger logger = LoggerFactory.getLogger(EmailNotificationHandler.class);

  private final AppointmentEmailSender emailSender;

  public void handle(NotificationJob job) {
    final EmailPayload payload = job.emailPayload();
    if (payload.to() == null || payload.to().isBlank()) {
      throw new InvalidNotificationJobException("email job has no recipient");
    }
    final AppointmentSnapshot schedule = payload.schedule();
    if (schedule == null) {
      throw new InvalidNotificationJobException("email job has no appointment snapshot");
    }

    final boolean accepted;
    try {
      accepted = send(payload, schedule);
    } catch (RuntimeException ex) {
      logger.error(
          "email delivery failed tenantId={} to={} confirmationCode={} scheduleId={} variant={}",
          job.tenantId(),
          payload.to(),
          payload.confirmationCode(),
          schedule.id(),
          payload.eventKind(),
          ex);
      throw ex;
    }
    if (!accepted) {
      logger.warn(
          "email provider did not accept message tenantId={} to={} scheduleId={} variant={}",
          job.tenantId(),
          payload.to(),
          schedule.id(),
          payload.eventKind());
    }
  }

  private boolean send(EmailPayload payload, AppointmentSnapshot schedule) {
    return switch (payload.eventKind()) {
      case REMINDER -> emailSender.sendReminderEmail(
          payload.to(), payload.confirmationCode(), schedule, payload.hoursUntilAppointment());
      case RESCHEDULE -> emailSender.sendRescheduleEmail(
          payload.to(),
          payload.confirmationCode(),
          schedule,
          payload.oldStartTime(),
          payload.oldEndTime());
      case CANCELLATION -> emailSender.sendCancellationEmail(
          payload.to(), payload.confirmationCode(), schedule);
      case CONFIRMATION -> emailSender.sendConfirmationEmail(
          payload.to(), payload.confirmationCode(), schedule);
    };
  }
}
