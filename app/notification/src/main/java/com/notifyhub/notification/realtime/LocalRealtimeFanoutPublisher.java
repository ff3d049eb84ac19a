/*
 * どこで: Notification realtime 層
 * 何を: NATS 無効時に同一プロセス内のセッションへ直接 group-send する
 * なぜ: 単一プロセス構成やローカル開発でもバス無しで in-app 配信できるようにするため
 */
package com.notifyhub.notification.realtime;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalRealtimeFanoutPublisher implements RealtimeFanoutPublisher {

  private final RealtimeGroupSender groupSender;

  @Override
  public void groupSend(long recipientId, RealtimeFrame frame) {
    groupSender.deliver(recipientId, frame);
  }
}
