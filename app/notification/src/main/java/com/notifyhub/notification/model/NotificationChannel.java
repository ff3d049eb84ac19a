/*
 * どこで: Notification モデル
 * 何を: 配信チャネルの列挙とワイヤ表現の対応を持つ
 * なぜ: DB と enqueue 契約で同一の文字列表現を使うため
 */
package com.notifyhub.notification.model;

public enum NotificationChannel {
  EMAIL("email"),
  IN_APP("in_app");

  private final String value;

  NotificationChannel(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static NotificationChannel fromValue(String value) {
    for (NotificationChannel channel : values()) {
      if (channel.value.equals(value)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("unsupported channel: " + value);
  }
}
