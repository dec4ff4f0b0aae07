/*
 * Where: Dock notification domain model
 * What: Discriminant of a notification job
 * Why: Fix the set of delivery channels a job may target
 */
package com.example.docknotification.model;

public enum NotificationKind {
  EMAIL("email", "email-notification", EmailPayload.class),
  REALTIME("realtime", "realtime-notification", RealtimePayload.class),
  PUSH("push", "push-notification", PushPayload.class);

  private final String value;
  private final String jobName;
  private final Class<? extends NotificationPayload> payloadType;

  NotificationKind(String value, String jobName, Class<? extends NotificationPayload> payloadType) {
    this.value = value;
    this.jobName = jobName;
    this.payloadType = payloadType;
  }

  public String value() {
    return value;
  }

  /** Name stored with queued jobs, visible in queue inspection. */
  public String jobName() {
    return jobName;
  }

  public Class<? extends NotificationPayload> payloadType() {
    return payloadType;
  }

  /**
   * Resolves a stored kind value, ignoring case.
   *
   * @throws IllegalArgumentException when the value names no supported kind
   */
  public static NotificationKind fromValue(String value) {
    for (NotificationKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unsupported notification kind: " + value);
  }
}
