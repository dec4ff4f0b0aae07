/*
 * Where: Dock notification service layer
 * What: Email sender that only logs
 * Why: Confirm job flow end to end without an email provider
 */
package com.example.docknotification.service;

import com.example.docknotification.model.AppointmentSnapshot;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalAppointmentEmailSender implements AppointmentEmailSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalAppointmentEmailSender.class);

  @Override
  public boolean sendConfirmationEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule) {
    logger.info(
        "email simulated send variant=confirmation to={} confirmationCode={} scheduleId={}",
        to,
        confirmationCode,
        schedule.id());
    return true;
  }

  @Override
  public boolean sendReminderEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule, int hoursUntilAppointment) {
    logger.info(
        "email simulated send variant=reminder to={} confirmationCode={} scheduleId={} hours={}",
        to,
        confirmationCode,
        schedule.id(),
        hoursUntilAppointment);
    return true;
  }

  @Override
  public boolean sendRescheduleEmail(
      String to,
      String confirmationCode,
      AppointmentSnapshot schedule,
      Instant oldStartTime,
      Instant oldEndTime) {
    logger.info(
        "email simulated send variant=reschedule to={} confirmationCode={} scheduleId={} oldStart={}",
        to,
        confirmationCode,
        schedule.id(),
        oldStartTime);
    return true;
  }

  @Override
  public boolean sendCancellationEmail(
      String to, String confirmationCode, AppointmentSnapshot schedule) {
    logger.info(
        "email simulated send variant=cancellation to={} confirmationCode={} scheduleId={}",
        to,
        confirmationCode,
        schedule.id());
    return true;
  }
}
