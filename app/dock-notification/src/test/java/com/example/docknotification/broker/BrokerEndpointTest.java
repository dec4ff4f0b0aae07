package com.example.docknotification.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.docknotification.config.NotificationBrokerProperties;
import org.junit.jupiter.api.Test;

class BrokerEndpointTest {

  @Test
  void urlTakesPrecedenceOverHost() {
    final BrokerEndpoint endpoint =
        BrokerEndpoint.from(
            new NotificationBrokerProperties(
                "rediss://:secret@cache.internal:6380/2", "ignored", 6379, "other", null, null));

    assertThat(endpoint.host()).isEqualTo("cache.internal");
    assertThat(endpoint.port()).isEqualTo(6380);
    assertThat(endpoint.database()).isEqualTo(2);
    assertThat(endpoint.ssl()).isTrue();
    assertThat(endpoint.password()).containsExactly("secret".toCharArray());
    assertThat(endpoint.describe()).isEqualTo("rediss://cache.internal:6380/2").doesNotContain("secret");
  }

  @Test
  void hostAndPortWithoutPassword() {
    final BrokerEndpoint endpoint =
        BrokerEndpoint.from(new NotificationBrokerProperties(null, " cache ", null, "", null, null));

    assertThat(endpoint.host()).isEqualTo("cache");
    assertThat(endpoint.port()).isEqualTo(NotificationBrokerProperties.DEFAULT_PORT);
    assertThat(endpoint.password()).isNull();
    assertThat(endpoint.ssl()).isFalse();
    assertThat(endpoint.describe()).isEqualTo("redis://cache:6379/0");
  }
}
