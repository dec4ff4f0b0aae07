/*
 * Where: Dock notification domain model
 * What: One appointment lifecycle change with the fields its notifications need
 * Why: Producers describe what happened, routing to channels happens in one place
 */
package com.example.docknotification.model;

import java.time.Instant;
import java.util.Objects;

public record AppointmentEvent(
    AppointmentEventType type,
    long tenantId,
    AppointmentSnapshot schedule,
    Long userId,
    String confirmationCode,
    Instant oldStartTime,
    Instant oldEndTime,
    Integer hoursUntilAppointment,
    String reason) {

  public AppointmentEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(schedule, "schedule");
  }

  public static AppointmentEvent created(long tenantId, AppointmentSnapshot schedule, Long userId) {
    return new AppointmentEvent(
        AppointmentEventType.CREATED, tenantId, schedule, userId, null, null, null, null, null);
  }

  public static AppointmentEvent confirmed(
      long tenantId, AppointmentSnapshot schedule, String confirmationCode) {
    return new AppointmentEvent(
        AppointmentEventType.CONFIRMED,
        tenantId,
        schedule,
        null,
        confirmationCode,
        null,
        null,
        null,
        null);
  }

  public static AppointmentEvent checkedIn(long tenantId, AppointmentSnapshot schedule) {
    return new AppointmentEvent(
        AppointmentEventType.CHECKED_IN, tenantId, schedule, null, null, null, null, null, null);
  }

  public static AppointmentEvent rescheduled(
      long tenantId,
      AppointmentSnapshot schedule,
      String confirmationCode,
      Instant oldStartTime,
      Instant oldEndTime) {
    return new AppointmentEvent(
        AppointmentEventType.RESCHEDULED,
        tenantId,
        schedule,
        null,
        confirmationCode,
        oldStartTime,
        oldEndTime,
        null,
        null);
  }

  public static AppointmentEvent cancelled(
      long tenantId, AppointmentSnapshot schedule, String confirmationCode, String reason) {
    return new AppointmentEvent(
        AppointmentEventType.CANCELLED,
        tenantId,
        schedule,
        null,
        confirmationCode,
        null,
        null,
        null,
        reason);
  }

  public static AppointmentEvent noShow(long tenantId, AppointmentSnapshot schedule) {
    return new AppointmentEvent(
        AppointmentEventType.NO_SHOW, tenantId, schedule, null, null, null, null, null, null);
  }

  public static AppointmentEvent reminderDue(
      long tenantId,
      AppointmentSnapshot schedule,
      String confirmationCode,
      int hoursUntilAppointment) {
    return new AppointmentEvent(
        AppointmentEventType.REMINDER_DUE,
        tenantId,
        schedule,
        null,
        confirmationCode,
        null,
        null,
        hoursUntilAppointment,
        null);
  }

  /** Event user when given, otherwise whoever created the appointment. May be null. */
  public Long recipientUserId() {
    return userId != null ? userId : schedule.createdBy();
  }
}
