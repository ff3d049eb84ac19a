/*
 * どこで: Notification アプリの設定バインド
 * 何を: NATS 接続設定をプロパティから読み込む
 * なぜ: ワーカーと realtime プロセス間の fanout バス接続先を環境ごとに切り替えるため
 */
package com.notifyhub.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {

  public NatsProperties {
    url = url == null || url.isBlank() ? "nats://localhost:4222" : url;
    connectionTimeout = connectionTimeout == null ? 2 : connectionTimeout;
  }
}
