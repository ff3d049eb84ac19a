/*
 * どこで: Notification データアクセス
 * 何を: notification_jobs の登録/claim/状態遷移/既読化を担う
 * なぜ: ジョブ状態の唯一の正を DB に置き、排他を行ロックと CAS 更新で担保するため
 */
package com.notifyhub.notification.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.notification.model.NotificationJob;
import com.notifyhub.notification.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationJobRepository {

  private static final String SELECT_COLUMNS =
      """
      id, recipient_id, channel, notification_type, message_data::text AS message_data_text,
      status, retries_count, max_retries, failed_reason, scheduled_at, sent_at, is_read,
      locked_by, locked_at, lease_until, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(NotificationJob job) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          recipient_id,
          channel,
          notification_type,
          message_data,
          status,
          retries_count,
          max_retries,
          scheduled_at,
          is_read,
          created_at,
          updated_at
        ) VALUES (
          :recipientId,
          :channel,
          :notificationType,
          :messageData::jsonb,
          :status,
          :retriesCount,
          :maxRetries,
          :scheduledAt,
          FALSE,
          :createdAt,
          :updatedAt
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", job.recipientId())
            .addValue("channel", job.channel())
            .addValue("notificationType", job.notificationType())
            .addValue("messageData", job.messageDataJson())
            .addValue("status", job.status().name())
            .addValue("retriesCount", job.retriesCount())
            .addValue("maxRetries", job.maxRetries())
            .addValue("scheduledAt", toTimestamp(job.scheduledAt()))
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("updatedAt", toTimestamp(job.updatedAt()));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("notification job insert returned no id");
    }
    return id;
  }

  public Optional<NotificationJob> findById(long id) {
    final String sql = "SELECT " + SELECT_COLUMNS + " FROM notification_jobs WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationJob> findByRecipientId(long recipientId) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM notification_jobs
            WHERE recipient_id = :recipientId
            ORDER BY created_at DESC, id DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationJob> claimDueBatch(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 期日到来の PENDING を SKIP LOCKED で選び、同一 SQL で SENDING を書き込む。
    // UPDATE 側でも PENDING を再確認し、別プロセスが先に進めた行は返さない。
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM notification_jobs
          WHERE status = 'PENDING'
            AND scheduled_at <= :now
          ORDER BY scheduled_at, id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs j
        SET status = 'SENDING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE j.id = cte.id
          AND j.status = 'PENDING'
        RETURNING j.id, j.recipient_id, j.channel, j.notification_type,
                  j.message_data::text AS message_data_text,
                  j.status, j.retries_count, j.max_retries, j.failed_reason,
                  j.scheduled_at, j.sent_at, j.is_read,
                  j.locked_by, j.locked_at, j.lease_until, j.created_at, j.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    // RETURNING は順序を保証しないため、呼び出し側の処理順を scheduled_at 昇順に揃える
    final List<NotificationJob> claimed = jdbcTemplate.query(sql, params, this::mapRow);
    return claimed.stream()
        .sorted(
            Comparator.comparing(NotificationJob::scheduledAt)
                .thenComparingLong(NotificationJob::id))
        .toList();
  }

  public int markSent(long id, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'SENT',
            sent_at = :sentAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :sentAt
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      long id,
      int retriesCount,
      Instant scheduledAt,
      String failedReason,
      Instant now,
      String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'PENDING',
            retries_count = :retriesCount,
            scheduled_at = :scheduledAt,
            failed_reason = :failedReason,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retriesCount", retriesCount)
            .addValue("scheduledAt", toTimestamp(scheduledAt))
            .addValue("failedReason", failedReason)
            .addValue("now", toTimestamp(now))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(
      long id, int retriesCount, String failedReason, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'FAILED',
            retries_count = :retriesCount,
            failed_reason = :failedReason,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE id = :id
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("retriesCount", retriesCount)
            .addValue("failedReason", failedReason)
            .addValue("now", toTimestamp(now))
            .addValue("id", id)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public List<NotificationJob> findUnreadInApp(long recipientId) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM notification_jobs
            WHERE recipient_id = :recipientId
              AND channel = 'in_app'
              AND status = 'SENT'
              AND is_read = FALSE
            ORDER BY created_at, id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markRead(long id, Instant now) {
    // 送信はワーカーが SENDING を保持している間に起こるため SENDING も対象にする。
    // is_read = FALSE 条件で true -> false の逆行と二重更新を防ぐ。
    final String sql =
        """
        UPDATE notification_jobs
        SET is_read = TRUE,
            updated_at = :now
        WHERE id = :id
          AND channel = 'in_app'
          AND status IN ('SENDING', 'SENT')
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markReadForRecipient(long id, long recipientId, Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET is_read = TRUE,
            updated_at = :now
        WHERE id = :id
          AND recipient_id = :recipientId
          AND channel = 'in_app'
          AND status = 'SENT'
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("recipientId", recipientId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int recoverExpiredLeases(Instant now, Instant retryAt, String failedReason) {
    // lease 切れの SENDING は失敗 1 回として扱い、上限到達なら FAILED、それ以外は PENDING へ戻す
    final String sql =
        """
        UPDATE notification_jobs
        SET status = CASE WHEN retries_count + 1 >= max_retries THEN 'FAILED' ELSE 'PENDING' END,
            retries_count = retries_count + 1,
            scheduled_at = CASE WHEN retries_count + 1 >= max_retries THEN scheduled_at
                                ELSE :retryAt END,
            failed_reason = :failedReason,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE status = 'SENDING'
          AND lease_until IS NOT NULL
          AND lease_until <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("retryAt", toTimestamp(retryAt))
            .addValue("failedReason", failedReason);
    return jdbcTemplate.update(sql, params);
  }

  public int countPending() {
    final String sql = "SELECT COUNT(*) FROM notification_jobs WHERE status = 'PENDING'";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationJob(
        rs.getLong("id"),
        rs.getLong("recipient_id"),
        rs.getString("channel"),
        rs.getString("notification_type"),
        rs.getString("message_data_text"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("retries_count"),
        rs.getInt("max_retries"),
        rs.getString("failed_reason"),
        toInstant(rs.getTimestamp("scheduled_at")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getBoolean("is_read"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
