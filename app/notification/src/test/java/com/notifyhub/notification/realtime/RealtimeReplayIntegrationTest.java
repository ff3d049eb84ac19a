/*
 * どこで: Notification realtime 層の統合テスト
 * 何を: 実 WebSocket 接続で未読リプレイ/ライブ配信/ハンドシェイク拒否を検証する
 * なぜ: オフライン中の in-app 通知が再接続時に届き、既読化されることを通しで保証するため
 */
package com.notifyhub.notification.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.AbstractPostgresContainerTest;
import com.notifyhub.notification.model.NotificationChannel;
import com.notifyhub.notification.repository.NotificationJobRepository;
import com.notifyhub.notification.service.NotificationBackend;
import com.notifyhub.notification.service.NotificationDeliveryService;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class RealtimeReplayIntegrationTest extends AbstractPostgresContainerTest {

    private static final long RECIPIENT_ID = 21L;
    private static final long ONLINE_RECIPIENT_ID = 22L;
    private static final String INTERNAL_TOKEN = "test-internal-token";

    @LocalServerPort
    private int port;

    @Autowired
    private NotificationBackend notificationBackend;

    @Autowired
    private NotificationDeliveryService deliveryService;

    @Autowired
    private NotificationJobRepository jobRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RealtimeSessionRegistry sessionRegistry;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
    }

    @Test
    void offlineNotificationIsReplayedOnConnectAndMarkedRead() throws Exception {
        long jobId = notificationBackend.enqueue(
                RECIPIENT_ID, NotificationChannel.IN_APP, Map.of("title", "while offline"), "t").orElseThrow();
        deliveryService.processPendingBatch();
        assertThat(jobRepository.findById(jobId).orElseThrow().read()).isFalse();

        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        WebSocketSession client = connect(RECIPIENT_ID, received);
        try {
            JsonNode frame = objectMapper.readTree(received.poll(5, TimeUnit.SECONDS));
            assertThat(frame.path("type").asText()).isEqualTo(RealtimeFrame.TYPE_NOTIFICATION_MISSED);
            assertThat(frame.path("job_id").asLong()).isEqualTo(jobId);
            assertThat(frame.path("data").path("title").asText()).isEqualTo("while offline");
            assertThat(awaitRead(jobId)).isTrue();
        } finally {
            client.close();
        }
    }

    @Test
    void onlineRecipientReceivesLivePush() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        WebSocketSession client = connect(ONLINE_RECIPIENT_ID, received);
        try {
            assertThat(awaitRegistered(ONLINE_RECIPIENT_ID)).isTrue();
            long jobId = notificationBackend.enqueue(
                    ONLINE_RECIPIENT_ID, NotificationChannel.IN_APP, Map.of("title", "live"), "t").orElseThrow();
            deliveryService.processPendingBatch();

            JsonNode frame = objectMapper.readTree(received.poll(5, TimeUnit.SECONDS));
            assertThat(frame.path("type").asText()).isEqualTo(RealtimeFrame.TYPE_NOTIFICATION);
            assertThat(frame.path("job_id").asLong()).isEqualTo(jobId);
            assertThat(awaitRead(jobId)).isTrue();
        } finally {
            client.close();
        }
    }

    @Test
    void handshakeWithoutInternalTokenIsRejected() {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("X-User-Id", String.valueOf(RECIPIENT_ID));

        assertThatThrownBy(() -> new StandardWebSocketClient()
                .execute(new TextWebSocketHandler(), headers, endpoint())
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class);
    }

    private WebSocketSession connect(long recipientId, BlockingQueue<String> received) throws Exception {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("X-Internal-Token", INTERNAL_TOKEN);
        headers.add("X-User-Id", String.valueOf(recipientId));
        TextWebSocketHandler clientHandler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                received.add(message.getPayload());
            }
        };
        return new StandardWebSocketClient().execute(clientHandler, headers, endpoint()).get(5, TimeUnit.SECONDS);
    }

    private URI endpoint() {
        return URI.create("ws://localhost:" + port + "/ws/notifications");
    }

    // クライアント側の接続完了とサーバ側のセッション登録は非同期
    private boolean awaitRegistered(long recipientId) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(5));
        while (Instant.now().isBefore(deadline)) {
            if (sessionRegistry.sessionCount(recipientId) > 0) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    // 既読化はフレーム送信の後に行われるため、短時間ポーリングで待つ
    private boolean awaitRead(long jobId) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(5));
        while (Instant.now().isBefore(deadline)) {
            if (jobRepository.findById(jobId).orElseThrow().read()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
