/*
 * どこで: Notification 配信ハンドラ
 * 何を: チャネル送信の失敗を表す
 * なぜ: 送信失敗はすべてワーカーのリトライ方針に委ねるため
 */
package com.notifyhub.notification.delivery;

public class DeliveryException extends RuntimeException {

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
