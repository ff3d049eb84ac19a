/*
 * どこで: Notification realtime 層
 * 何を: WebSocket ハンドシェイクで内部トークンとユーザー ID ヘッダを検証する
 * なぜ: 未認証の接続をアップグレード前に 401 で拒否するため
 */
package com.notifyhub.notification.realtime;

import com.notifyhub.notification.config.NotificationRealtimeProperties;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

public class RealtimeHandshakeInterceptor implements HandshakeInterceptor {

  public static final String RECIPIENT_ID_ATTRIBUTE = "recipientId";

  private static final Logger logger = LoggerFactory.getLogger(RealtimeHandshakeInterceptor.class);

  private final NotificationRealtimeProperties.Auth auth;

  public RealtimeHandshakeInterceptor(NotificationRealtimeProperties.Auth auth) {
    this.auth = auth;
  }

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final String actualToken = request.getHeaders().getFirst(auth.headerName());
    if (!isValidInternalToken(actualToken)) {
      logger.warn("realtime handshake rejected: invalid internal token uri={}", request.getURI());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    final Long recipientId = parseRecipientId(request.getHeaders().getFirst(auth.userIdHeaderName()));
    if (recipientId == null) {
      logger.warn(
          "realtime handshake rejected: missing or invalid header {} uri={}",
          auth.userIdHeaderName(),
          request.getURI());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    attributes.put(RECIPIENT_ID_ATTRIBUTE, recipientId);
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {
    if (exception != null) {
      logger.warn("realtime handshake failed uri={}", request.getURI(), exception);
    }
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null && !auth.token().isBlank() && actualToken.equals(auth.token());
  }

  private Long parseRecipientId(String forwardedUserId) {
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      return null;
    }
    try {
      long value = Long.parseLong(forwardedUserId.trim());
      return value > 0 ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
