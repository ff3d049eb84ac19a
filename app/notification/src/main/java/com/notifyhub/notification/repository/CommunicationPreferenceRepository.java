/*
 * どこで: Notification データアクセス
 * 何を: user_communication_preferences の参照と upsert を担う
 * なぜ: enqueue 時の opt-out 判定と、外部プロデューサによる設定更新を支えるため
 */
package com.notifyhub.notification.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.notification.model.CommunicationPreference;
import com.notifyhub.notification.model.NotificationChannel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CommunicationPreferenceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CommunicationPreference> findByRecipientId(long recipientId) {
    final String sql =
        """
        SELECT recipient_id, prefers_email, prefers_in_app, default_channel
        FROM user_communication_preferences
        WHERE recipient_id = :recipientId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void upsert(CommunicationPreference preference, Instant now) {
    final String sql =
        """
        INSERT INTO user_communication_preferences (
          recipient_id, prefers_email, prefers_in_app, default_channel, created_at, updated_at
        ) VALUES (
          :recipientId, :prefersEmail, :prefersInApp, :defaultChannel, :now, :now
        )
        ON CONFLICT (recipient_id) DO UPDATE
        SET prefers_email = EXCLUDED.prefers_email,
            prefers_in_app = EXCLUDED.prefers_in_app,
            default_channel = EXCLUDED.default_channel,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", preference.recipientId())
            .addValue("prefersEmail", preference.prefersEmail())
            .addValue("prefersInApp", preference.prefersInApp())
            .addValue("defaultChannel", preference.defaultChannel().value())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  private CommunicationPreference mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CommunicationPreference(
        rs.getLong("recipient_id"),
        rs.getBoolean("prefers_email"),
        rs.getBoolean("prefers_in_app"),
        NotificationChannel.fromValue(rs.getString("default_channel")));
  }
}
