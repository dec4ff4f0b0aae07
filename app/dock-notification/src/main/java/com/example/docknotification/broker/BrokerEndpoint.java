package com.example.docknotification.broker;

import com.example.docknotification.config.NotificationBrokerProperties;
import io.lettuce.core.RedisURI;

/** Resolved Redis endpoint. {@code password} may be null. */
record BrokerEndpoint(
    String host, int port, String username, char[] password, int database, boolean ssl) {

  static BrokerEndpoint from(NotificationBrokerProperties properties) {
    if (properties.url() != null && !properties.url().isBlank()) {
      final RedisURI uri = RedisURI.create(properties.url().trim());
      final char[] password = uri.getPassword();
      return new BrokerEndpoint(
          uri.getHost(),
          uri.getPort(),
          uri.getUsername(),
          password == null || password.length == 0 ? null : password,
          uri.getDatabase(),
          uri.isSsl());
    }
    final String password = properties.password();
    return new BrokerEndpoint(
        properties.host().trim(),
        properties.resolvedPort(),
        null,
        password == null || password.isEmpty() ? null : password.toCharArray(),
        0,
        false);
  }

  /** Printable form without credentials. */
  String describe() {
    return (ssl ? "rediss://" : "redis://") + host + ":" + port + "/" + database;
  }
}
