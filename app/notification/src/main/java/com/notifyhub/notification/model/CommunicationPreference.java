/*
 * どこで: Notification モデル
 * 何を: 受信者ごとのチャネル opt-in/opt-out を表す
 * なぜ: enqueue 時の配信可否判定に使うため
 */
package com.notifyhub.notification.model;

public record CommunicationPreference(
    long recipientId,
    boolean prefersEmail,
    boolean prefersInApp,
    NotificationChannel defaultChannel) {

  public boolean allows(NotificationChannel channel) {
    return switch (channel) {
      case EMAIL -> prefersEmail;
      case IN_APP -> prefersInApp;
    };
  }
}
