package com.example.docknotification.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.docknotification.TestAppointments;
import com.example.docknotification.model.EmailEventKind;
import com.example.docknotification.model.EmailPayload;
import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.RealtimePayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class NotificationJobCodecTest {

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  private final NotificationJobCodec codec = new NotificationJobCodec(objectMapper);

  @Test
  void rescheduleEmailKeepsVariantAndOldTimes() {
    final Instant oldStart = Instant.parse("2026-03-01T14:00:00Z");
    final Instant oldEnd = Instant.parse("2026-03-01T15:00:00Z");
    final NotificationJob job =
        NotificationJob.email(
            TestAppointments.TENANT_ID,
            EmailPayload.reschedule(
                TestAppointments.DRIVER_EMAIL,
                "ABC123",
                TestAppointments.scheduled(),
                oldStart,
                oldEnd));

    final NotificationJob decoded = codec.decode(codec.encode(job));

    assertThat(decoded).isEqualTo(job);
    assertThat(decoded.emailPayload().eventKind()).isEqualTo(EmailEventKind.RESCHEDULE);
  }

  @Test
  void encodedJobCarriesKindAndTenant() throws Exception {
    final NotificationJob job =
        NotificationJob.realtime(
            9L, 42L, null, new RealtimePayload("appointment:created", objectMapper.createObjectNode()));

    final var tree = objectMapper.readTree(codec.encode(job));

    assertThat(tree.get("kind").asText()).isEqualTo("realtime");
    assertThat(tree.get("tenantId").asLong()).isEqualTo(9L);
    assertThat(tree.get("scheduleId").asLong()).isEqualTo(42L);
    assertThat(tree.has("userId")).isFalse();
    assertThat(tree.path("payload").get("eventType").asText()).isEqualTo("appointment:created");
  }

  @Test
  void realtimeJobWithoutDataDecodesToTheSubmittedValue() {
    final NotificationJob job =
        NotificationJob.realtime(9L, null, null, new RealtimePayload("appointment:deleted", null));

    final NotificationJob decoded = codec.decode(codec.encode(job));

    assertThat(decoded).isEqualTo(job);
    assertThat(decoded.realtimePayload().data()).isEqualTo(NullNode.getInstance());
  }

  @Test
  void realtimePayloadWithMissingDataFieldDecodesAsNullNode() {
    final NotificationJob decoded =
        codec.decode(
            "{\"kind\":\"realtime\",\"tenantId\":9,\"payload\":{\"eventType\":\"ping\"}}");

    assertThat(decoded.realtimePayload().data()).isEqualTo(NullNode.getInstance());
  }

  @Test
  void unknownKindIsADecodeFailure() {
    assertThatThrownBy(() -> codec.decode("{\"kind\":\"sms\",\"tenantId\":1,\"payload\":{}}"))
        .isInstanceOf(NotificationJobDecodeException.class)
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void corruptJsonIsADecodeFailure() {
    assertThatThrownBy(() -> codec.decode("{not json"))
        .isInstanceOf(NotificationJobDecodeException.class);
  }

  @Test
  void missingPayloadIsADecodeFailure() {
    assertThatThrownBy(() -> codec.decode("{\"kind\":\"push\",\"tenantId\":1}"))
        .isInstanceOf(NotificationJobDecodeException.class)
        .hasMessageContaining("no payload");
  }
}
