/*
 * Where: Dock notification configuration binding
 * What: Redis broker endpoint for the notification queues
 * Why: Leaving both url and host empty is a supported way to run without queueing
 */
package com.example.docknotification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.broker")
@Validated
public record NotificationBrokerProperties(
    String url,
    String host,
    @Min(1) @Max(65535) Integer port,
    String password,
    Duration connectTimeout,
    Duration commandTimeout) {

  public static final int DEFAULT_PORT = 6379;

  /** True when either a URL or a host is set. */
  public boolean isConfigured() {
    return hasText(url) || hasText(host);
  }

  public int resolvedPort() {
    return port == null ? DEFAULT_PORT : port;
  }

  @AssertTrue(message = "notification.broker.url must use the redis:// or rediss:// scheme")
  public boolean isUrlSchemeSupported() {
    if (!hasText(url)) {
      return true;
    }
    final String trimmed = url.trim();
    return trimmed.startsWith("redis://") || trimmed.startsWith("rediss://");
  }

  @AssertTrue(message = "notification.broker.connect-timeout must be positive")
  public boolean isConnectTimeoutPositive() {
    return connectTimeout == null || isPositiveDuration(connectTimeout);
  }

  @AssertTrue(message = "notification.broker.command-timeout must be positive")
  public boolean isCommandTimeoutPositive() {
    return commandTimeout == null || isPositiveDuration(commandTimeout);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static boolean isPositiveDuration(Duration duration) {
    return !duration.isZero() && !duration.isNegative();
  }
}
