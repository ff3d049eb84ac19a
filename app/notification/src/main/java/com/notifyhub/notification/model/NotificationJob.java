/*
 * どこで: Notification モデル
 * 何を: notification_jobs の 1 行を表す
 * なぜ: ワーカーと realtime 層で同じ行表現を共有するため
 */
package com.notifyhub.notification.model;

import java.time.Instant;

/**
 * 通知ジョブ。
 *
 * <p>channel は文字列のまま保持する。未知チャネルの行もワーカーが読み出し、恒久失敗として終わらせる必要があるため。
 */
public record NotificationJob(
    long id,
    long recipientId,
    String channel,
    String notificationType,
    String messageDataJson,
    NotificationStatus status,
    int retriesCount,
    int maxRetries,
    String failedReason,
    Instant scheduledAt,
    Instant sentAt,
    boolean read,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {

  /** INSERT 前の PENDING ジョブを組み立てる。id は DB 採番。 */
  public static NotificationJob newPending(
      long recipientId,
      NotificationChannel channel,
      String notificationType,
      String messageDataJson,
      int maxRetries,
      Instant now) {
    return new NotificationJob(
        0L,
        recipientId,
        channel.value(),
        notificationType,
        messageDataJson,
        NotificationStatus.PENDING,
        0,
        maxRetries,
        null,
        now,
        null,
        false,
        null,
        null,
        null,
        now,
        now);
  }
}
