/*
 * Where: Dock notification domain model
 * What: Snapshot of a persisted in-app notification row
 * Why: Shared by the store, the realtime fanout payload and the inbox debug API
 */
package com.example.docknotification.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record Notification(
    long id,
    long userId,
    String title,
    String message,
    String type,
    Long relatedScheduleId,
    @JsonProperty("isRead") boolean isRead,
    Instant createdAt) {}
