/*
 * Where: Dock notification queue layer
 * What: JSON encoding of notification jobs stored in the broker
 * Why: Job bodies outlive the process that enqueued them, so the format has to be explicit
 */
package com.example.docknotification.queue;

import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.NotificationKind;
import com.example.docknotification.model.NotificationPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.stereotype.Component;

@Component
public class NotificationJobCodec {

  static final String FIELD_KIND = "kind";
  static final String FIELD_TENANT_ID = "tenantId";
  static final String FIELD_SCHEDULE_ID = "scheduleId";
  static final String FIELD_USER_ID = "userId";
  static final String FIELD_PAYLOAD = "payload";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component and cannot be copied")
  private final ObjectMapper objectMapper;

  public NotificationJobCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(NotificationJob job) {
    final ObjectNode root = objectMapper.createObjectNode();
    root.put(FIELD_KIND, job.kind().value());
    root.put(FIELD_TENANT_ID, job.tenantId());
    if (job.scheduleId() != null) {
      root.put(FIELD_SCHEDULE_ID, job.scheduleId());
    }
    if (job.userId() != null) {
      root.put(FIELD_USER_ID, job.userId());
    }
    root.set(FIELD_PAYLOAD, objectMapper.valueToTree(job.payload()));
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification job serialization failure", ex);
    }
  }

  public NotificationJob decode(String data) {
    if (data == null || data.isBlank()) {
      throw new NotificationJobDecodeException("empty notification job body", null);
    }
    try {
      final JsonNode root = objectMapper.readTree(data);
      final NotificationKind kind = NotificationKind.fromValue(root.path(FIELD_KIND).asText(null));
      final JsonNode payloadNode = root.get(FIELD_PAYLOAD);
      if (payloadNode == null || payloadNode.isNull()) {
        throw new NotificationJobDecodeException("notification job has no payload", null);
      }
      final NotificationPayload payload = objectMapper.treeToValue(payloadNode, kind.payloadType());
      return new NotificationJob(
          kind,
          root.path(FIELD_TENANT_ID).asLong(),
          optionalLong(root, FIELD_SCHEDULE_ID),
          optionalLong(root, FIELD_USER_ID),
          payload);
    } catch (NotificationJobDecodeException ex) {
      throw ex;
    } catch (JsonProcessingException | RuntimeException ex) {
      throw new NotificationJobDecodeException("notification job decode failure", ex);
    }
  }

  private static Long optionalLong(JsonNode root, String field) {
    final JsonNode node = root.get(field);
    return node == null || node.isNull() ? null : node.asLong();
  }
}
