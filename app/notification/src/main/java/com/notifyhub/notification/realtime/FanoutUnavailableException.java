/*
 * どこで: Notification realtime 層
 * 何を: fanout バスが未設定/切断中であることを表す
 * なぜ: in-app 配信を通常のリトライ対象として扱えるようにするため
 */
package com.notifyhub.notification.realtime;

public class FanoutUnavailableException extends RuntimeException {

  public FanoutUnavailableException(String message) {
    super(message);
  }

  public FanoutUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
