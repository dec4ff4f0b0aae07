package com.example.docknotification.model;

/** Appointment lifecycle events that produce notifications. */
public enum AppointmentEventType {
  CREATED("created"),
  CONFIRMED("confirmed"),
  CHECKED_IN("checked_in"),
  RESCHEDULED("rescheduled"),
  CANCELLED("cancelled"),
  NO_SHOW("no_show"),
  REMINDER_DUE("reminder_due");

  private final String value;

  AppointmentEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Realtime event name, e.g. {@code appointment:checked_in}. */
  public String eventName() {
    return "appointment:" + value;
  }
}
