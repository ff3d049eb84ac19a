/*
 * どこで: Notification realtime 層
 * 何を: NATS subject <prefix>.> を購読し、このプロセスのセッションへ group-send する
 * なぜ: どのプロセスに接続していても受信者の全端末へ届けるため
 */
package com.notifyhub.notification.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.notifyhub.notification.config.NotificationRealtimeProperties;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"nats.enabled", "notification.realtime.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class RealtimeFanoutSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeFanoutSubscriber.class);

    private final Connection connection;
    private final RealtimeGroupSender groupSender;
    private final NotificationRealtimeProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;

    public RealtimeFanoutSubscriber(Connection connection,
            RealtimeGroupSender groupSender,
            NotificationRealtimeProperties properties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.groupSender = groupSender;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        // core pub/sub: 接続中のプロセスだけが受け取れば良いので JetStream は使わない
        dispatcher = connection.createDispatcher(this::handleMessage);
        dispatcher.subscribe(properties.subjectPrefix() + ".>");
        logger.info("realtime fanout subscriber started subject={}.>", properties.subjectPrefix());
    }

    @PreDestroy
    public void stop() {
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
        started.set(false);
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        Long recipientId = parseRecipientId(message.getSubject());
        if (recipientId == null) {
            logger.warn("realtime fanout message ignored: unexpected subject={}", message.getSubject());
            return;
        }
        try {
            RealtimeFrame frame = objectMapper.readValue(message.getData(), RealtimeFrame.class);
            groupSender.deliver(recipientId, frame);
        } catch (IOException ex) {
            // 破損 payload は再送されても回復しないため破棄する
            logger.warn("failed to parse realtime fanout payload subject={}", message.getSubject(), ex);
        } catch (RuntimeException ex) {
            // 1 メッセージの失敗で dispatcher を止めない
            logger.warn("failed to deliver realtime fanout message subject={}", message.getSubject(), ex);
        }
    }

    private Long parseRecipientId(String subject) {
        String prefix = properties.subjectPrefix() + ".";
        if (subject == null || !subject.startsWith(prefix)) {
            return null;
        }
        try {
            return Long.parseLong(subject.substring(prefix.length()));
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
