/*
 * どこで: Notification 配信ハンドラ
 * 何を: in-app 通知を受信者グループへ group-send する
 * なぜ: 「fanout 層が受け付けた」時点を配信完了とし、既読はクライアント側の経路に任せるため
 */
package com.notifyhub.notification.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.notifyhub.notification.model.NotificationChannel;
import com.notifyhub.notification.realtime.FanoutUnavailableException;
import com.notifyhub.notification.realtime.RealtimeFanoutPublisher;
import com.notifyhub.notification.realtime.RealtimeFrame;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InAppDeliveryHandler implements DeliveryHandler {

  private static final Logger logger = LoggerFactory.getLogger(InAppDeliveryHandler.class);

  private final ObjectProvider<RealtimeFanoutPublisher> publisherProvider;

  @Override
  public String channel() {
    return NotificationChannel.IN_APP.value();
  }

  @Override
  public void send(long recipientId, JsonNode messageData, long jobId) {
    RealtimeFanoutPublisher publisher = publisherProvider.getIfAvailable();
    if (publisher == null) {
      throw new DeliveryException("fanout layer not configured");
    }
    try {
      publisher.groupSend(recipientId, RealtimeFrame.notification(messageData, jobId));
      logger.debug("in-app notification handed to fanout jobId={} recipientId={}", jobId, recipientId);
    } catch (FanoutUnavailableException ex) {
      throw new DeliveryException("fanout layer unavailable: " + ex.getMessage(), ex);
    }
  }
}
