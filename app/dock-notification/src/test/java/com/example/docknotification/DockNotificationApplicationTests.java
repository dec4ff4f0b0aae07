package com.example.docknotification;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.docknotification.service.DeliveryMode;
import com.example.docknotification.service.NotificationSubsystem;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DockNotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private NotificationSubsystem subsystem;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Test
  void contextLoadsInDirectModeWithoutBroker() {
    assertThat(subsystem.mode()).isEqualTo(DeliveryMode.DIRECT);
    assertThat(subsystem.queues()).isEmpty();
  }

  @Test
  void cachedContextStillReachesMigratedDatabase() {
    assertThat(POSTGRES.isRunning()).isTrue();
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM notifications", new MapSqlParameterSource(), Long.class))
        .isNotNull();
  }
}
