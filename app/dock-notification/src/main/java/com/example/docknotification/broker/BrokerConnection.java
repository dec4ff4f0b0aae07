/*
 * Where: Dock notification broker layer
 * What: Single lazily created Redis connection shared by queues and workers
 * Why: Only this class holds a broker socket, and an unconfigured broker means direct delivery
 */
package com.example.docknotification.broker;

import com.example.docknotification.config.NotificationBrokerProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.event.Event;
import io.lettuce.core.event.connection.ConnectedEvent;
import io.lettuce.core.event.connection.DisconnectedEvent;
import io.lettuce.core.event.connection.ReconnectAttemptEvent;
import io.lettuce.core.event.connection.ReconnectFailedEvent;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

public class BrokerConnection {

  private static final Logger logger = LoggerFactory.getLogger(BrokerConnection.class);

  private final NotificationBrokerProperties properties;
  private final Object lock = new Object();

  // guarded by lock
  private ClientResources clientResources;
  private LettuceConnectionFactory connectionFactory;
  private StringRedisTemplate template;
  private boolean shutDown;

  public BrokerConnection(NotificationBrokerProperties properties) {
    this.properties = properties;
  }

  public boolean isConfigured() {
    return properties.isConfigured();
  }

  /**
   * Returns the shared template, creating the connection on first use. Empty when no broker is
   * configured or after {@link #shutdown()}.
   */
  public Optional<StringRedisTemplate> getConnection() {
    if (!isConfigured()) {
      return Optional.empty();
    }
    synchronized (lock) {
      if (shutDown) {
        return Optional.empty();
      }
      if (template == null) {
        initialise();
      }
      return Optional.of(template);
    }
  }

  /** PING round trip. False when unconfigured, shut down or unreachable. */
  public boolean healthCheck() {
    final Optional<StringRedisTemplate> connection;
    try {
      connection = getConnection();
    } catch (RuntimeException ex) {
      logger.warn("notification broker health check could not connect", ex);
      return false;
    }
    if (connection.isEmpty()) {
      return false;
    }
    try {
      final String pong = connection.get().execute((RedisCallback<String>) RedisConnection::ping);
      return "PONG".equalsIgnoreCase(pong);
    } catch (RuntimeException ex) {
      logger.warn("notification broker ping failed error={}", ex.getMessage());
      return false;
    }
  }

  public void shutdown() {
    synchronized (lock) {
      if (shutDown) {
        return;
      }
      shutDown = true;
      if (connectionFactory != null) {
        try {
          connectionFactory.destroy();
        } catch (RuntimeException ex) {
          logger.warn("notification broker connection close failed", ex);
        }
      }
      if (clientResources != null) {
        clientResources.shutdown();
      }
      connectionFactory = null;
      clientResources = null;
      template = null;
      logger.info("notification broker connection closed");
    }
  }

  private void initialise() {
    final BrokerEndpoint endpoint = BrokerEndpoint.from(properties);
    final RedisStandaloneConfiguration standalone =
        new RedisStandaloneConfiguration(endpoint.host(), endpoint.port());
    standalone.setDatabase(endpoint.database());
    if (endpoint.username() != null && !endpoint.username().isBlank()) {
      standalone.setUsername(endpoint.username());
    }
    if (endpoint.password() != null) {
      standalone.setPassword(RedisPassword.of(endpoint.password()));
    }

    final ClientResources resources = DefaultClientResources.create();
    resources.eventBus().get().subscribe(this::onConnectionEvent);

    final LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettuceClientConfiguration.builder().clientResources(resources);
    if (endpoint.ssl()) {
      builder.useSsl().and();
    }
    if (properties.commandTimeout() != null) {
      builder.commandTimeout(properties.commandTimeout());
    }
    if (properties.connectTimeout() != null) {
      builder.clientOptions(
          ClientOptions.builder()
              .socketOptions(
                  SocketOptions.builder().connectTimeout(properties.connectTimeout()).build())
              .build());
    }

    final LettuceConnectionFactory factory =
        new LettuceConnectionFactory(standalone, builder.build());
    try {
      factory.afterPropertiesSet();
    } catch (RuntimeException ex) {
      logger.error("notification broker initialisation failed endpoint={}", endpoint.describe(), ex);
      resources.shutdown();
      throw ex;
    }

    clientResources = resources;
    connectionFactory = factory;
    template = new StringRedisTemplate(factory);
    logger.info(
        "notification broker configured backend=redis endpoint={} auth={}",
        endpoint.describe(),
        endpoint.password() != null);
  }

  private void onConnectionEvent(Event event) {
    if (event instanceof ConnectedEvent connected) {
      logger.info("notification broker connected remote={}", connected.remoteAddress());
    } else if (event instanceof DisconnectedEvent disconnected) {
      logger.warn("notification broker disconnected remote={}", disconnected.remoteAddress());
    } else if (event instanceof ReconnectAttemptEvent attempt) {
      logger.info("notification broker reconnecting attempt={}", attempt.getAttempt());
    } else if (event instanceof ReconnectFailedEvent failed) {
      logger.error(
          "notification broker reconnect failed attempt={}", failed.getAttempt(), failed.getCause());
    }
  }
}
