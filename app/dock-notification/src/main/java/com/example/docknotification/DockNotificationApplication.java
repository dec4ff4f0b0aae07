/*
 * Where: Dock notification application entry point
 * What: Boots Spring and scans configuration properties
 * Why: The Redis connection is owned by the notification subsystem, not by Boot auto-configuration
 */
package com.example.docknotification;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication(
    exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DockNotificationApplication {

  public static void main(String[] args) {
    SpringApplication.run(DockNotificationApplication.class, args);
  }
}
