/*
 * どこで: Notification サービス層
 * 何を: enqueue 入力が契約を満たさないことを表す
 * なぜ: ストレージ障害と呼び出し側の誤用を区別して伝えるため
 */
package com.notifyhub.notification.service;

public class InvalidNotificationRequestException extends RuntimeException {

  public InvalidNotificationRequestException(String message) {
    super(message);
  }
}
