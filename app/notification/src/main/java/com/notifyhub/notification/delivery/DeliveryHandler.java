/*
 * どこで: Notification 配信ハンドラ
 * 何を: チャネルごとの送信契約を定義する
 * なぜ: ワーカーがチャネルを意識せず同じ呼び方で配信できるようにするため
 */
package com.notifyhub.notification.delivery;

import com.fasterxml.jackson.databind.JsonNode;

public interface DeliveryHandler {

  /** DB の channel 列と同じワイヤ表現 (例: "email")。 */
  String channel();

  /**
   * 1 件送信する。ハンドラ自身はリトライしない。
   *
   * @throws DeliveryException 送信に失敗した場合
   */
  void send(long recipientId, JsonNode messageData, long jobId);
}
