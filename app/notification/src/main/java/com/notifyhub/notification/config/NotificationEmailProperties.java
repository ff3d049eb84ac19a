/*
 * どこで: Notification アプリの設定バインド
 * 何を: メール送信元アドレスを保持する
 * なぜ: 送信元を環境ごとに切り替えるため (SMTP 接続自体は spring.mail.* に従う)
 */
package com.notifyhub.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.email")
public record NotificationEmailProperties(String fromAddress) {

  public NotificationEmailProperties {
    fromAddress =
        fromAddress == null || fromAddress.isBlank() ? "no-reply@notifyhub.local" : fromAddress;
  }
}
