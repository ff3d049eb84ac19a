/*
 * どこで: Notification モデル
 * 何を: 通知ジョブの状態を表す
 * なぜ: notification_jobs.status の CHECK 制約と同じ値集合を型で扱うため
 */
package com.notifyhub.notification.model;

/** 遷移 (PENDING -> SENDING -> {SENT, PENDING, FAILED}) は NotificationJobRepository の条件付き UPDATE で強制する。 */
public enum NotificationStatus {
  PENDING,
  SENDING,
  SENT,
  FAILED
}
