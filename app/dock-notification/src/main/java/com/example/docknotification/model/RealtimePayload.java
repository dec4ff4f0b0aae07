package com.example.docknotification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * Event fanned out to every connected listener of a tenant. Absent data is held as {@link
 * NullNode}, the same value a queued job decodes to, so listeners see one shape in every mode.
 */
public record RealtimePayload(String eventType, JsonNode data) implements NotificationPayload {

  public RealtimePayload {
    Objects.requireNonNull(eventType, "eventType");
    data = data == null ? NullNode.getInstance() : data;
  }

  @JsonIgnore
  @Override
  public NotificationKind kind() {
    return NotificationKind.REALTIME;
  }
}
