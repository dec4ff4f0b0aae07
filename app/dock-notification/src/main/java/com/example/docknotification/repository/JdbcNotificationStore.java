/*
 * Where: Dock notification data access
 * What: Inserts and lists in-app notifications in the notifications table
 * Why: In-app notifications are persisted before they are fanned out
 */
package com.example.docknotification.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.docknotification.model.NewNotification;
import com.example.docknotification.model.Notification;
import com.example.docknotification.service.NotificationStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationStore implements NotificationStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public Notification createNotification(NewNotification notification) {
    final String sql =
        """
        INSERT INTO notifications (
          user_id,
          title,
          message,
          type,
          related_schedule_id,
          is_read,
          created_at
        ) VALUES (
          :userId,
          :title,
          :message,
          :type,
          :relatedScheduleId,
          FALSE,
          :createdAt
        )
        RETURNING id, user_id, title, message, type, related_schedule_id, is_read, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", notification.userId())
            .addValue("title", notification.title())
            .addValue("message", notification.message())
            .addValue("type", notification.type())
            .addValue("relatedScheduleId", notification.relatedScheduleId())
            .addValue("createdAt", toTimestamp(clock.instant()));
    return jdbcTemplate.queryForObject(sql, params, (rs, rowNum) -> mapRow(rs));
  }

  @Override
  public List<Notification> findByUserId(long userId, int limit) {
    final String sql =
        """
        SELECT id, user_id, title, message, type, related_schedule_id, is_read, created_at
        FROM notifications
        WHERE user_id = :userId
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> mapRow(rs));
  }

  private Notification mapRow(ResultSet rs) throws SQLException {
    final long rawScheduleId = rs.getLong("related_schedule_id");
    final Long relatedScheduleId = rs.wasNull() ? null : rawScheduleId;
    return new Notification(
        rs.getLong("id"),
        rs.getLong("user_id"),
        rs.getString("title"),
        rs.getString("message"),
        rs.getString("type"),
        relatedScheduleId,
        rs.getBoolean("is_read"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
