/*
 * どこで: Notification realtime 層
 * 何を: 送信済み in-app ジョブの is_read を true にする
 * なぜ: 既読化は配信経路から見てベストエフォートで、DB 障害をソケットへ波及させないため
 */
package com.notifyhub.notification.realtime;

import com.notifyhub.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationReadTracker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationReadTracker.class);

  private final NotificationJobRepository jobRepository;
  private final Clock clock;

  /** 少なくとも 1 セッションへ送信した後にだけ呼ぶこと。 */
  public boolean markTransmitted(long jobId) {
    try {
      return jobRepository.markRead(jobId, Instant.now(clock)) > 0;
    } catch (DataAccessException ex) {
      logger.warn("failed to mark notification read jobId={}", jobId, ex);
      return false;
    }
  }

  /** クライアントからの明示的な既読通知。自分宛てのジョブ以外は無視される。 */
  public boolean markAcknowledged(long jobId, long recipientId) {
    try {
      return jobRepository.markReadForRecipient(jobId, recipientId, Instant.now(clock)) > 0;
    } catch (DataAccessException ex) {
      logger.warn(
          "failed to record read receipt jobId={} recipientId={}", jobId, recipientId, ex);
      return false;
    }
  }
}
