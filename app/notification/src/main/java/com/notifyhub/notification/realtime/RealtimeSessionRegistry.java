/*
 * どこで: Notification realtime 層
 * 何を: 受信者 ID ごとのライブ WebSocket セッション集合を保持し、グループ送信する
 * なぜ: 1 受信者の複数端末へ同時配信し、遅いクライアントを他から独立して切断するため
 */
package com.notifyhub.notification.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.config.NotificationRealtimeProperties;
import com.notifyhub.notification.service.NotificationMetrics;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Component
public class RealtimeSessionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeSessionRegistry.class);

  // recipientId -> (sessionId -> 送信用デコレータ)
  private final Map<Long, Map<String, WebSocketSession>> groups = new ConcurrentHashMap<>();
  private final NotificationRealtimeProperties properties;
  private final ObjectMapper objectMapper;
  private final NotificationMetrics metrics;

  public RealtimeSessionRegistry(
      NotificationRealtimeProperties properties,
      ObjectMapper objectMapper,
      NotificationMetrics metrics) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
  }

  /** セッションを登録し、以後の送信に使うデコレータを返す。 */
  public WebSocketSession register(long recipientId, WebSocketSession session) {
    WebSocketSession decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.sendTimeLimit().toMillis(),
            properties.sendBufferSizeLimit());
    // 追加はマップ操作の中で行う。外で put すると unregister が空グループを消した直後に取り残される
    groups.compute(
        recipientId,
        (key, sessions) -> {
          Map<String, WebSocketSession> group =
              sessions == null ? new ConcurrentHashMap<>() : sessions;
          group.put(session.getId(), decorated);
          return group;
        });
    metrics.updateRealtimeSessions(sessionCount());
    logger.info("realtime session registered recipientId={} sessionId={}", recipientId, session.getId());
    return decorated;
  }

  public void unregister(long recipientId, WebSocketSession session) {
    groups.computeIfPresent(
        recipientId,
        (key, sessions) -> {
          sessions.remove(session.getId());
          // 空になったグループは削除する
          return sessions.isEmpty() ? null : sessions;
        });
    metrics.updateRealtimeSessions(sessionCount());
    logger.info(
        "realtime session unregistered recipientId={} sessionId={}", recipientId, session.getId());
  }

  /**
   * 受信者の全セッションへ送る。
   *
   * @return 送信を受け付けたセッション数
   */
  public int groupSend(long recipientId, RealtimeFrame frame) {
    Map<String, WebSocketSession> sessions = groups.get(recipientId);
    if (sessions == null || sessions.isEmpty()) {
      return 0;
    }
    TextMessage message = toMessage(frame);
    int delivered = 0;
    for (WebSocketSession session : List.copyOf(sessions.values())) {
      if (transmit(recipientId, session, message)) {
        delivered++;
      }
    }
    return delivered;
  }

  /** 1 セッションへ送る。失敗したセッションは閉じて登録解除する。 */
  public boolean sendTo(long recipientId, WebSocketSession session, RealtimeFrame frame) {
    return transmit(recipientId, session, toMessage(frame));
  }

  public int sessionCount() {
    return groups.values().stream().mapToInt(Map::size).sum();
  }

  public int sessionCount(long recipientId) {
    Map<String, WebSocketSession> sessions = groups.get(recipientId);
    return sessions == null ? 0 : sessions.size();
  }

  private boolean transmit(long recipientId, WebSocketSession session, TextMessage message) {
    if (!session.isOpen()) {
      unregister(recipientId, session);
      return false;
    }
    try {
      session.sendMessage(message);
      return true;
    } catch (IOException | RuntimeException ex) {
      // 送信制限超過 (SessionLimitExceededException) を含め、このセッションだけ切り離す
      logger.warn(
          "realtime send failed; closing session recipientId={} sessionId={}",
          recipientId,
          session.getId(),
          ex);
      unregister(recipientId, session);
      closeQuietly(session);
      return false;
    }
  }

  private void closeQuietly(WebSocketSession session) {
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (IOException ex) {
      logger.debug("failed to close realtime session sessionId={}", session.getId(), ex);
    }
  }

  private TextMessage toMessage(RealtimeFrame frame) {
    try {
      return new TextMessage(objectMapper.writeValueAsString(frame));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize realtime frame", ex);
    }
  }
}
