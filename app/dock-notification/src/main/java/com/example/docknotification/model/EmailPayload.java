/*
 * Where: Dock notification domain model
 * What: Body of an email job, tagged with its email variant
 * Why: Validate variant-specific fields once, when the job is built
 */
package com.example.docknotification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;

public record EmailPayload(
    String to,
    String confirmationCode,
    AppointmentSnapshot schedule,
    EmailEventKind eventKind,
    Instant oldStartTime,
    Instant oldEndTime,
    Integer hoursUntilAppointment)
    implements NotificationPayload {

  public EmailPayload {
    Objects.requireNonNull(eventKind, "eventKind");
    switch (eventKind) {
      case REMINDER -> {
        if (hoursUntilAppointment == null) {
          throw new IllegalArgumentException("reminder email requires hoursUntilAppointment");
        }
      }
      case RESCHEDULE -> {
        if (oldStartTime == null || oldEndTime == null) {
          throw new IllegalArgumentException("reschedule email requires oldStartTime and oldEndTime");
        }
      }
      default -> {
        // confirmation and cancellation carry no extra fields
      }
    }
  }

  public static EmailPayload confirmation(
      String to, String confirmationCode, AppointmentSnapshot schedule) {
    return new EmailPayload(
        to, confirmationCode, schedule, EmailEventKind.CONFIRMATION, null, null, null);
  }

  public static EmailPayload cancellation(
      String to, String confirmationCode, AppointmentSnapshot schedule) {
    return new EmailPayload(
        to, confirmationCode, schedule, EmailEventKind.CANCELLATION, null, null, null);
  }

  public static EmailPayload reminder(
      String to, String confirmationCode, AppointmentSnapshot schedule, int hoursUntilAppointment) {
    return new EmailPayload(
        to, confirmationCode, schedule, EmailEventKind.REMINDER, null, null, hoursUntilAppointment);
  }

  public static EmailPayload reschedule(
      String to,
      String confirmationCode,
      AppointmentSnapshot schedule,
      Instant oldStartTime,
      Instant oldEndTime) {
    return new EmailPayload(
        to,
        confirmationCode,
        schedule,
        EmailEventKind.RESCHEDULE,
        oldStartTime,
        oldEndTime,
        null);
  }

  /**
   * Builds a payload for callers that only hold the raw optional fields.
   *
   * <p>The variant is picked first-match-wins: reminder hours, then both old times, then a
   * cancelled snapshot, otherwise confirmation. Fields that do not belong to the picked variant
   * are kept as given.
   */
  public static EmailPayload inferred(
      String to,
      String confirmationCode,
      AppointmentSnapshot schedule,
      Instant oldStartTime,
      Instant oldEndTime,
      Integer hoursUntilAppointment) {
    return new EmailPayload(
        to,
        confirmationCode,
        schedule,
        inferEventKind(schedule, oldStartTime, oldEndTime, hoursUntilAppointment),
        oldStartTime,
        oldEndTime,
        hoursUntilAppointment);
  }

  static EmailEventKind inferEventKind(
      AppointmentSnapshot schedule,
      Instant oldStartTime,
      Instant oldEndTime,
      Integer hoursUntilAppointment) {
    if (hoursUntilAppointment != null) {
      return EmailEventKind.REMINDER;
    }
    if (oldStartTime != null && oldEndTime != null) {
      return EmailEventKind.RESCHEDULE;
    }
    if (schedule != null && schedule.isCancelled()) {
      return EmailEventKind.CANCELLATION;
    }
    return EmailEventKind.CONFIRMATION;
  }

  @JsonIgnore
  @Override
  public NotificationKind kind() {
    return NotificationKind.EMAIL;
  }
}
