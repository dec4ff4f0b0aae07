package com.example.docknotification.service;

import com.example.docknotification.model.AppointmentSnapshot;
import java.time.Instant;

/**
 * Email provider seam. Each method returns whether the provider accepted the message and may throw
 * on transport failure.
 */
public interface AppointmentEmailSender {

  boolean sendConfirmationEmail(String to, String confirmationCode, AppointmentSnapshot schedule);

  boolean sendReminderEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule, int hoursUntilAppointment);

  boolean sendRescheduleEmail(
      String to,
      String confirmationCode,
      AppointmentSnapshot schedule,
      Instant oldStartTime,
      Instant oldEndTime);

  boolean sendCancellationEmail(String to, String confirmationCode, AppointmentSnapshot schedule);
}
