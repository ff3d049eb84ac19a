/*
 * どこで: Notification サービス層
 * 何を: 期日到来の PENDING ジョブを claim し、チャネルのハンドラで送信して状態を進める
 * なぜ: 送信/リトライ/恒久失敗の状態機械をジョブ単位で独立に制御するため
 */
package com.notifyhub.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.notifyhub.common.TraceIds;
import com.notifyhub.notification.config.NotificationDeliveryProperties;
import com.notifyhub.notification.delivery.DeliveryException;
import com.notifyhub.notification.delivery.DeliveryHandler;
import com.notifyhub.notification.delivery.DeliveryHandlerRegistry;
import com.notifyhub.notification.model.NotificationJob;
import com.notifyhub.notification.repository.NotificationJobRepository;

import lombok.RequiredArgsConstructor;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

    static final String NO_HANDLER_REASON = "no handler for channel";

    private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
    private static final String HOSTNAME_ENV = "HOSTNAME";
    private static final String DEFAULT_HOSTNAME = "unknown-host";

    private final NotificationJobRepository jobRepository;
    private final DeliveryHandlerRegistry handlerRegistry;
    private final NotificationDeliveryProperties properties;
    private final NotificationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    // 同一ホストで複数ワーカーを動かしても locked_by が衝突しないようにする
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    /**
     * 1 バッチ処理する。
     *
     * @return claim したジョブ数
     */
    public int processPendingBatch() {
        Instant now = Instant.now(clock);
        String lockedBy = resolveLockedBy();
        Instant leaseUntil = now.plus(properties.lease());
        // claim と SENDING 書き込みを単一 SQL で行い、送信 IO を長期トランザクションに載せない
        List<NotificationJob> claimed = jobRepository.claimDueBatch(
                properties.batchSize(),
                now,
                leaseUntil,
                lockedBy);
        for (NotificationJob job : claimed) {
            try {
                processJob(job, lockedBy);
            } catch (DataAccessException ex) {
                // 状態更新に失敗したジョブは SENDING のまま残り、lease 切れで回収される
                logger.error("failed to persist notification outcome id={}", job.id(), ex);
            }
        }
        metrics.updateBacklogCurrent(jobRepository.countPending());
        if (!claimed.isEmpty()) {
            logger.info("notification batch processed claimed={} lockedBy={}", claimed.size(), lockedBy);
        }
        return claimed.size();
    }

    @VisibleForTesting
    void processJob(NotificationJob job, String lockedBy) {
        MDC.put("job_id", String.valueOf(job.id()));
        MDC.put("recipient_id", String.valueOf(job.recipientId()));
        MDC.put("channel", job.channel());
        TraceIds.ensureTraceId();
        try {
            Optional<DeliveryHandler> handler = handlerRegistry.find(job.channel());
            if (handler.isEmpty()) {
                markUnroutable(job, lockedBy);
                return;
            }
            try {
                handler.get().send(job.recipientId(), readMessageData(job), job.id());
            } catch (RuntimeException ex) {
                // ハンドラ例外は種類を問わずリトライ対象
                handleFailure(job, ex, lockedBy);
                return;
            }
            markSent(job, lockedBy);
        } finally {
            MDC.remove("job_id");
            MDC.remove("recipient_id");
            MDC.remove("channel");
            MDC.remove(TraceIds.MDC_KEY);
        }
    }

    private void markSent(NotificationJob job, String lockedBy) {
        Instant sentAt = Instant.now(clock);
        int updated = jobRepository.markSent(job.id(), sentAt, lockedBy);
        if (updated == 0) {
            logger.warn("notification sent but lock was lost id={} recipientId={}", job.id(), job.recipientId());
            metrics.recordDeliveryResult(NotificationMetrics.RESULT_LOCK_LOST);
            return;
        }
        metrics.recordDeliveryResult(NotificationMetrics.RESULT_SENT);
        metrics.recordDeliveryE2eDelay(job.createdAt(), sentAt);
        logger.info("notification job sent id={} recipientId={} channel={}", job.id(), job.recipientId(), job.channel());
    }

    private void markUnroutable(NotificationJob job, String lockedBy) {
        // 未知チャネルはリトライしても解決しないため即 FAILED (retries は増やさない)
        int updated = jobRepository.markFailed(
                job.id(),
                job.retriesCount(),
                NO_HANDLER_REASON,
                Instant.now(clock),
                lockedBy);
        if (updated == 0) {
            logger.warn("notification unroutable but lock was lost id={}", job.id());
            metrics.recordDeliveryResult(NotificationMetrics.RESULT_LOCK_LOST);
            return;
        }
        metrics.recordDeliveryResult(NotificationMetrics.RESULT_UNROUTABLE);
        logger.warn("notification job failed: no handler id={} channel={}", job.id(), job.channel());
    }

    @VisibleForTesting
    void handleFailure(NotificationJob job, RuntimeException ex, String lockedBy) {
        Instant now = Instant.now(clock);
        int retries = job.retriesCount() + 1;
        String reason = truncateError(ex.getMessage());
        if (retries >= job.maxRetries()) {
            int updated = jobRepository.markFailed(job.id(), retries, reason, now, lockedBy);
            if (updated == 0) {
                logger.warn("notification failure skipped because lock was lost id={} retries={}",
                        job.id(),
                        retries);
                metrics.recordDeliveryResult(NotificationMetrics.RESULT_LOCK_LOST);
                return;
            }
            metrics.recordDeliveryResult(NotificationMetrics.RESULT_FAILED);
            logger.warn("notification job failed permanently id={} retries={}", job.id(), retries, ex);
            return;
        }
        Instant nextAttemptAt = now.plus(properties.retryBackoff());
        int updated = jobRepository.markRetry(job.id(), retries, nextAttemptAt, reason, now, lockedBy);
        if (updated == 0) {
            logger.warn("notification retry skipped because lock was lost id={} retries={}",
                    job.id(),
                    retries);
            metrics.recordDeliveryResult(NotificationMetrics.RESULT_LOCK_LOST);
            return;
        }
        metrics.recordDeliveryResult(NotificationMetrics.RESULT_RETRY);
        logger.warn("notification retry scheduled id={} retries={} nextAttemptAt={}",
                job.id(),
                retries,
                nextAttemptAt,
                ex);
    }

    private JsonNode readMessageData(NotificationJob job) {
        try {
            return objectMapper.readTree(job.messageDataJson());
        } catch (JsonProcessingException ex) {
            throw new DeliveryException("unreadable message_data: " + ex.getOriginalMessage(), ex);
        }
    }

    @VisibleForTesting
    String truncateError(String message) {
        if (message == null) {
            return "unknown error";
        }
        int maxLength = properties.errorMessageMaxLength();
        if (message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength);
    }

    @VisibleForTesting
    String resolveLockedBy() {
        return resolveHostname() + ":" + instanceId;
    }

    private String resolveHostname() {
        String env = System.getenv(HOSTNAME_ENV);
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException ex) {
            logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
            return DEFAULT_HOSTNAME;
        }
    }
}
