/*
 * どこで: Notification realtime 層
 * 何を: in-app フレームを NATS subject <prefix>.<recipientId> へ publish する
 * なぜ: ワーカーと WebSocket 接続を保持するプロセスが別でも group-send を届けるため
 */
package com.notifyhub.notification.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.config.NotificationRealtimeProperties;
import io.nats.client.Connection;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsRealtimeFanoutPublisher implements RealtimeFanoutPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NatsRealtimeFanoutPublisher.class);

  private final Connection connection;
  private final NotificationRealtimeProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void groupSend(long recipientId, RealtimeFrame frame) {
    if (connection.getStatus() != Connection.Status.CONNECTED) {
      throw new FanoutUnavailableException("nats connection status is " + connection.getStatus());
    }
    String subject = subjectFor(properties.subjectPrefix(), recipientId);
    try {
      connection.publish(subject, objectMapper.writeValueAsBytes(frame));
      logger.debug("realtime frame published subject={} jobId={}", subject, frame.jobId());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize realtime frame", ex);
    } catch (IllegalStateException ex) {
      // 接続クローズ後の publish は IllegalStateException になる
      throw new FanoutUnavailableException("nats publish failed: " + ex.getMessage(), ex);
    }
  }

  static String subjectFor(String prefix, long recipientId) {
    return prefix + "." + recipientId;
  }
}
