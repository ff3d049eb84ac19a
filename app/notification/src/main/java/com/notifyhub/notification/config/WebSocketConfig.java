/*
 * どこで: Notification アプリのインフラ設定
 * 何を: 通知用 WebSocket エンドポイントとハンドシェイク認証を登録する
 * なぜ: realtime 有効なプロセスだけが固定パスで接続を受け付けるようにするため
 */
package com.notifyhub.notification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.realtime.NotificationReadTracker;
import com.notifyhub.notification.realtime.NotificationWebSocketHandler;
import com.notifyhub.notification.realtime.RealtimeHandshakeInterceptor;
import com.notifyhub.notification.realtime.RealtimeSessionRegistry;
import com.notifyhub.notification.repository.NotificationJobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@ConditionalOnWebApplication
@ConditionalOnProperty(name = "notification.realtime.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final NotificationRealtimeProperties properties;
  private final RealtimeSessionRegistry sessionRegistry;
  private final NotificationJobRepository jobRepository;
  private final NotificationReadTracker readTracker;
  private final ObjectMapper objectMapper;

  @Bean
  public NotificationWebSocketHandler notificationWebSocketHandler() {
    return new NotificationWebSocketHandler(sessionRegistry, jobRepository, readTracker, objectMapper);
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    WebSocketHandlerRegistration registration =
        registry
            .addHandler(notificationWebSocketHandler(), properties.path())
            .addInterceptors(new RealtimeHandshakeInterceptor(properties.auth()));
    if (!properties.allowedOrigins().isEmpty()) {
      registration.setAllowedOrigins(properties.allowedOrigins().toArray(String[]::new));
    }
  }
}
