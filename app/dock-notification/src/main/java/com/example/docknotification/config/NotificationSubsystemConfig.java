/*
 * Where: Dock notification infrastructure configuration
 * What: Puts the notification subsystem under Spring lifecycle management
 * Why: The delivery mode is fixed at startup and shutdown runs on context close
 */
package com.example.docknotification.config;

import com.example.docknotification.broker.BrokerConnection;
import com.example.docknotification.queue.NotificationJobCodec;
import com.example.docknotification.service.NotificationDispatcher;
import com.example.docknotification.service.NotificationMetrics;
import com.example.docknotification.service.NotificationSubsystem;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationSubsystemConfig {

  @Bean(destroyMethod = "shutdown")
  public NotificationSubsystem notificationSubsystem(
      NotificationBrokerProperties brokerProperties,
      NotificationQueueProperties queueProperties,
      NotificationJobCodec codec,
      NotificationDispatcher dispatcher,
      NotificationMetrics metrics,
      Clock clock) {
    return NotificationSubsystem.create(
        new BrokerConnection(brokerProperties), queueProperties, codec, dispatcher, metrics, clock);
  }
}
