/*
 * どこで: Notification データアクセス
 * 何を: recipient_contacts から宛先メールアドレスを引く/登録する
 * なぜ: ユーザーアカウント本体を持たずにメール配信先を解決するため
 */
package com.notifyhub.notification.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientContactRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> findEmailAddress(long recipientId) {
    final String sql =
        """
        SELECT email_address
        FROM recipient_contacts
        WHERE recipient_id = :recipientId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.queryForList(sql, params, String.class).stream()
        .filter(address -> address != null && !address.isBlank())
        .findFirst();
  }

  public void upsert(long recipientId, String emailAddress, Instant now) {
    final String sql =
        """
        INSERT INTO recipient_contacts (recipient_id, email_address, updated_at)
        VALUES (:recipientId, :emailAddress, :now)
        ON CONFLICT (recipient_id) DO UPDATE
        SET email_address = EXCLUDED.email_address,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("emailAddress", emailAddress)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }
}
