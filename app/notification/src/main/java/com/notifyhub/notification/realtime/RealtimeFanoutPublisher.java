/*
 * どこで: Notification realtime 層
 * 何を: 受信者グループへの group-send を抽象化する
 * なぜ: ワーカーと接続保持プロセスが別でも同じ契約で配信できるようにするため
 */
package com.notifyhub.notification.realtime;

public interface RealtimeFanoutPublisher {

  /**
   * 受信者の全ライブ接続へフレームを流す。接続が無ければ誰にも届かない (耐久性は Job Store 側が持つ)。
   *
   * @throws FanoutUnavailableException fanout バスに到達できない場合
   */
  void groupSend(long recipientId, RealtimeFrame frame);
}
