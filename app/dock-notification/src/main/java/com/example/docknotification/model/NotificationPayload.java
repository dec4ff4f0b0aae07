package com.example.docknotification.model;

/** Kind-specific body of a {@link NotificationJob}. */
public sealed interface NotificationPayload permits EmailPayload, RealtimePayload, PushPayload {

  NotificationKind kind();
}
