/*
 * どこで: Notification サービス層
 * 何を: enqueue 要求を検証し、設定ゲートを通ったものを PENDING ジョブとして登録する
 * なぜ: 受理した要求を必ず 1 行だけ永続化し、拒否はエラーにせず静かにスキップするため
 */
package com.notifyhub.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.config.NotificationDeliveryProperties;
import com.notifyhub.notification.model.NotificationChannel;
import com.notifyhub.notification.model.NotificationJob;
import com.notifyhub.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DatabaseQueueNotificationBackend implements NotificationBackend {

  private static final Logger logger =
      LoggerFactory.getLogger(DatabaseQueueNotificationBackend.class);
  private static final int NOTIFICATION_TYPE_MAX_LENGTH = 50;

  private final NotificationJobRepository jobRepository;
  private final CommunicationPreferenceGate preferenceGate;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  @Transactional
  public OptionalLong enqueue(
      long recipientId,
      NotificationChannel channel,
      Map<String, Object> messageData,
      String notificationType) {
    validate(recipientId, channel, messageData);
    final String type = normalizeType(notificationType);

    if (!preferenceGate.allows(recipientId, channel)) {
      logger.info(
          "notification skipped by preference recipientId={} channel={} type={}",
          recipientId,
          channel.value(),
          type);
      metrics.recordEnqueueResult(NotificationMetrics.ENQUEUE_SKIPPED);
      return OptionalLong.empty();
    }

    final Instant now = Instant.now(clock);
    final NotificationJob job =
        NotificationJob.newPending(
            recipientId, channel, type, serialize(messageData), properties.maxRetries(), now);
    try {
      final long jobId = jobRepository.insert(job);
      logger.info(
          "notification job enqueued id={} recipientId={} channel={} type={}",
          jobId,
          recipientId,
          channel.value(),
          type);
      metrics.recordEnqueueResult(NotificationMetrics.ENQUEUE_ACCEPTED);
      return OptionalLong.of(jobId);
    } catch (DataAccessException ex) {
      // 取りこぼしを避けるため呼び出し側へ伝播し、再試行判断を委ねる
      logger.error(
          "failed to enqueue notification recipientId={} channel={} type={}",
          recipientId,
          channel.value(),
          type,
          ex);
      throw ex;
    }
  }

  private void validate(long recipientId, NotificationChannel channel, Map<String, Object> data) {
    if (recipientId <= 0) {
      throw new InvalidNotificationRequestException("recipientId must be positive");
    }
    if (channel == null) {
      throw new InvalidNotificationRequestException("channel is required");
    }
    if (data == null) {
      throw new InvalidNotificationRequestException("messageData is required");
    }
  }

  private String normalizeType(String notificationType) {
    if (notificationType == null || notificationType.isBlank()) {
      return DEFAULT_NOTIFICATION_TYPE;
    }
    final String trimmed = notificationType.trim();
    if (trimmed.length() > NOTIFICATION_TYPE_MAX_LENGTH) {
      throw new InvalidNotificationRequestException(
          "notificationType must be at most " + NOTIFICATION_TYPE_MAX_LENGTH + " characters");
    }
    return trimmed;
  }

  private String serialize(Map<String, Object> messageData) {
    try {
      return objectMapper.writeValueAsString(messageData);
    } catch (JsonProcessingException ex) {
      throw new InvalidNotificationRequestException(
          "messageData is not serializable: " + ex.getOriginalMessage());
    }
  }
}
