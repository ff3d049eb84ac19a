/*
 * どこで: Notification realtime 層
 * 何を: WebSocket の接続/切断/受信を扱い、接続時に未読 in-app 通知をリプレイする
 * なぜ: オフライン中に送信された通知を再接続時に取りこぼさず届けるため
 */
package com.notifyhub.notification.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.model.NotificationJob;
import com.notifyhub.notification.repository.NotificationJobRepository;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@RequiredArgsConstructor
public class NotificationWebSocketHandler extends TextWebSocketHandler {

  static final String READ_RECEIPT_TYPE = "read_receipt";

  private static final Logger logger = LoggerFactory.getLogger(NotificationWebSocketHandler.class);

  private final RealtimeSessionRegistry sessionRegistry;
  private final NotificationJobRepository jobRepository;
  private final NotificationReadTracker readTracker;
  private final ObjectMapper objectMapper;

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws IOException {
    final Long recipientId = recipientId(session);
    if (recipientId == null) {
      // ハンドシェイクで弾かれているはずだが、属性が無ければ即切断する
      logger.warn("realtime connection without recipient identity sessionId={}", session.getId());
      session.close(CloseStatus.POLICY_VIOLATION);
      return;
    }
    final WebSocketSession registered = sessionRegistry.register(recipientId, session);
    replayMissed(recipientId, registered);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    final Long recipientId = recipientId(session);
    logger.debug(
        "realtime message received recipientId={} sessionId={} length={}",
        recipientId,
        session.getId(),
        message.getPayloadLength());
    if (recipientId == null) {
      return;
    }
    final JsonNode payload;
    try {
      payload = objectMapper.readTree(message.getPayload());
    } catch (JsonProcessingException ex) {
      logger.debug("realtime message ignored: not json sessionId={}", session.getId());
      return;
    }
    if (payload == null
        || !READ_RECEIPT_TYPE.equals(payload.path("type").asText())
        || !payload.path("job_id").canConvertToLong()) {
      return;
    }
    final long jobId = payload.path("job_id").asLong();
    final boolean marked = readTracker.markAcknowledged(jobId, recipientId);
    logger.debug("read receipt recipientId={} jobId={} marked={}", recipientId, jobId, marked);
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("realtime transport error sessionId={}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    final Long recipientId = recipientId(session);
    if (recipientId != null) {
      sessionRegistry.unregister(recipientId, session);
    }
  }

  private void replayMissed(long recipientId, WebSocketSession session) {
    final List<NotificationJob> missed;
    try {
      missed = jobRepository.findUnreadInApp(recipientId);
    } catch (DataAccessException ex) {
      // 未読は DB に残るため次回接続で再度リプレイされる
      logger.warn("failed to load missed notifications recipientId={}", recipientId, ex);
      return;
    }
    int replayed = 0;
    for (NotificationJob job : missed) {
      final JsonNode data = readMessageData(job);
      if (data == null) {
        continue;
      }
      if (!sessionRegistry.sendTo(recipientId, session, RealtimeFrame.missed(data, job.id()))) {
        // セッションが落ちた場合、残りは次回接続で送る
        break;
      }
      readTracker.markTransmitted(job.id());
      replayed++;
    }
    if (replayed > 0) {
      logger.info("missed notifications replayed recipientId={} count={}", recipientId, replayed);
    }
  }

  private JsonNode readMessageData(NotificationJob job) {
    try {
      return objectMapper.readTree(job.messageDataJson());
    } catch (JsonProcessingException ex) {
      logger.warn("missed notification skipped: unreadable message_data jobId={}", job.id(), ex);
      return null;
    }
  }

  private Long recipientId(WebSocketSession session) {
    final Object value = session.getAttributes().get(RealtimeHandshakeInterceptor.RECIPIENT_ID_ATTRIBUTE);
    return value instanceof Long id ? id : null;
  }
}
