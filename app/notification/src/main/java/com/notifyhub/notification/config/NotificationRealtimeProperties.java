/*
 * どこで: Notification アプリの設定バインド
 * 何を: WebSocket エンドポイント/送信制限/fanout subject/ハンドシェイク認証の設定を保持する
 * なぜ: realtime 層を環境ごとに調整し、未設定時は安全な既定値に倒すため
 */
package com.notifyhub.notification.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.realtime")
public record NotificationRealtimeProperties(
    boolean enabled,
    String path,
    List<String> allowedOrigins,
    Duration sendTimeLimit,
    Integer sendBufferSizeLimit,
    String subjectPrefix,
    Auth auth) {

  public NotificationRealtimeProperties {
    path = path == null || path.isBlank() ? "/ws/notifications" : path;
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    sendTimeLimit = sendTimeLimit == null ? Duration.ofSeconds(10) : sendTimeLimit;
    sendBufferSizeLimit =
        sendBufferSizeLimit == null || sendBufferSizeLimit <= 0 ? 512 * 1024 : sendBufferSizeLimit;
    subjectPrefix =
        subjectPrefix == null || subjectPrefix.isBlank() ? "notification.realtime" : subjectPrefix;
    auth = auth == null ? new Auth(null, null, null) : auth;
  }

  /** gateway から転送される内部トークンとユーザー ID ヘッダ。 */
  public record Auth(String headerName, String token, String userIdHeaderName) {

    public Auth {
      headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
      token = token == null ? "" : token;
      userIdHeaderName =
          userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    }
  }
}
