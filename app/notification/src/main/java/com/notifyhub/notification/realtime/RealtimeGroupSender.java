/*
 * どこで: Notification realtime 層
 * 何を: ローカルのセッションへ group-send し、送信できたジョブを既読にする
 * なぜ: NATS 経由でも直接呼び出しでも同じ「送信してから既読」の順序を守るため
 */
package com.notifyhub.notification.realtime;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RealtimeGroupSender {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeGroupSender.class);

  private final RealtimeSessionRegistry sessionRegistry;
  private final NotificationReadTracker readTracker;

  public int deliver(long recipientId, RealtimeFrame frame) {
    int delivered = sessionRegistry.groupSend(recipientId, frame);
    if (delivered > 0 && frame.jobId() != null) {
      readTracker.markTransmitted(frame.jobId());
    }
    logger.debug(
        "realtime group-send recipientId={} jobId={} sessions={}",
        recipientId,
        frame.jobId(),
        delivered);
    return delivered;
  }
}
