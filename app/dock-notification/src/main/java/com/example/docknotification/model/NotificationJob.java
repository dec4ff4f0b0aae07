/*
 * Where: Dock notification domain model
 * What: Unit of work placed on a notification queue
 * Why: A job must never carry a payload for a kind other than its own
 */
package com.example.docknotification.model;

import java.util.Objects;

public record NotificationJob(
    NotificationKind kind, long tenantId, Long scheduleId, Long userId, NotificationPayload payload) {

  public NotificationJob {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payload, "payload");
    if (tenantId <= 0) {
      throw new IllegalArgumentException("tenantId must be positive: " + tenantId);
    }
    if (payload.kind() != kind) {
      throw new IllegalArgumentException(
          "payload kind " + payload.kind().value() + " does not match job kind " + kind.value());
    }
  }

  public static NotificationJob email(long tenantId, EmailPayload payload) {
    final Long scheduleId = payload.schedule() == null ? null : payload.schedule().id();
    return new NotificationJob(NotificationKind.EMAIL, tenantId, scheduleId, null, payload);
  }

  public static NotificationJob realtime(
      long tenantId, Long scheduleId, Long userId, RealtimePayload payload) {
    return new NotificationJob(NotificationKind.REALTIME, tenantId, scheduleId, userId, payload);
  }

  public static NotificationJob push(long tenantId, Long userId, PushPayload payload) {
    return new NotificationJob(NotificationKind.PUSH, tenantId, null, userId, payload);
  }

  public EmailPayload emailPayload() {
    return payloadAs(EmailPayload.class);
  }

  public RealtimePayload realtimePayload() {
    return payloadAs(RealtimePayload.class);
  }

  public PushPayload pushPayload() {
    return payloadAs(PushPayload.class);
  }

  private <P extends NotificationPayload> P payloadAs(Class<P> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "job of kind " + kind.value() + " has no " + type.getSimpleName());
    }
    return type.cast(payload);
  }
}
