package com.example.docknotification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/** Mobile push body. Reserved: the push handler does not deliver it yet. */
public record PushPayload(String title, String message, JsonNode data)
    implements NotificationPayload {

  @JsonIgnore
  @Override
  public NotificationKind kind() {
    return NotificationKind.PUSH;
  }
}
