/*
 * どこで: Notification enqueue のユニットテスト
 * 何を: 設定ゲートによるスキップ/入力検証/永続化失敗の伝播を検証する
 * なぜ: 拒否時に 1 行も書かず、受理時は必ず 1 行だけ書くことを保証するため
 */
package com.notifyhub.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.notification.config.NotificationDeliveryProperties;
import com.notifyhub.notification.model.CommunicationPreference;
import com.notifyhub.notification.model.NotificationChannel;
import com.notifyhub.notification.model.NotificationJob;
import com.notifyhub.notification.model.NotificationStatus;
import com.notifyhub.notification.repository.CommunicationPreferenceRepository;
import com.notifyhub.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DatabaseQueueNotificationBackendTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final NotificationDeliveryProperties PROPERTIES =
      new NotificationDeliveryProperties(
          10, 3, Duration.ofMinutes(5), 255, Duration.ofMinutes(10), true, Duration.ofMinutes(1));

  @Mock private NotificationJobRepository jobRepository;
  @Mock private CommunicationPreferenceRepository preferenceRepository;
  @Mock private NotificationMetrics metrics;

  private DatabaseQueueNotificationBackend backend;

  @BeforeEach
  void setUp() {
    backend =
        new DatabaseQueueNotificationBackend(
            jobRepository,
            new CommunicationPreferenceGate(preferenceRepository),
            PROPERTIES,
            metrics,
            new ObjectMapper(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void enqueueWithoutPreferenceRecordCreatesPendingJob() {
    when(preferenceRepository.findByRecipientId(1L)).thenReturn(Optional.empty());
    when(jobRepository.insert(any(NotificationJob.class))).thenReturn(100L);

    OptionalLong jobId =
        backend.enqueue(1L, NotificationChannel.EMAIL, Map.of("subject", "Hi"), "t");

    assertThat(jobId).hasValue(100L);
    final ArgumentCaptor<NotificationJob> captor = ArgumentCaptor.forClass(NotificationJob.class);
    verify(jobRepository).insert(captor.capture());
    final NotificationJob inserted = captor.getValue();
    assertThat(inserted.status()).isEqualTo(NotificationStatus.PENDING);
    assertThat(inserted.retriesCount()).isZero();
    assertThat(inserted.maxRetries()).isEqualTo(3);
    assertThat(inserted.scheduledAt()).isEqualTo(FIXED_NOW);
    assertThat(inserted.channel()).isEqualTo("email");
    assertThat(inserted.notificationType()).isEqualTo("t");
    assertThat(inserted.messageDataJson()).isEqualTo("{\"subject\":\"Hi\"}");
    verify(metrics).recordEnqueueResult(NotificationMetrics.ENQUEUE_ACCEPTED);
  }

  @Test
  void enqueueSkipsSilentlyWhenRecipientOptedOutOfEmail() {
    when(preferenceRepository.findByRecipientId(1L))
        .thenReturn(
            Optional.of(new CommunicationPreference(1L, false, true, NotificationChannel.IN_APP)));

    OptionalLong jobId =
        backend.enqueue(1L, NotificationChannel.EMAIL, Map.of("subject", "Hi"), "t");

    assertThat(jobId).isEmpty();
    verify(jobRepository, never()).insert(any());
    verify(metrics).recordEnqueueResult(NotificationMetrics.ENQUEUE_SKIPPED);
  }

  @Test
  void enqueueAllowsInAppWhenOnlyEmailIsDisabled() {
    when(preferenceRepository.findByRecipientId(1L))
        .thenReturn(
            Optional.of(new CommunicationPreference(1L, false, true, NotificationChannel.IN_APP)));
    when(jobRepository.insert(any(NotificationJob.class))).thenReturn(7L);

    assertThat(backend.enqueue(1L, NotificationChannel.IN_APP, Map.of(), "t")).hasValue(7L);
  }

  @Test
  void blankNotificationTypeFallsBackToGeneral() {
    when(preferenceRepository.findByRecipientId(1L)).thenReturn(Optional.empty());
    when(jobRepository.insert(any(NotificationJob.class))).thenReturn(1L);

    backend.enqueue(1L, NotificationChannel.IN_APP, Map.of(), " ");

    final ArgumentCaptor<NotificationJob> captor = ArgumentCaptor.forClass(NotificationJob.class);
    verify(jobRepository).insert(captor.capture());
    assertThat(captor.getValue().notificationType()).isEqualTo("general");
  }

  @Test
  void invalidRequestsAreRejectedBeforeTouchingStorage() {
    assertThatThrownBy(() -> backend.enqueue(0L, NotificationChannel.EMAIL, Map.of(), "t"))
        .isInstanceOf(InvalidNotificationRequestException.class);
    assertThatThrownBy(() -> backend.enqueue(1L, null, Map.of(), "t"))
        .isInstanceOf(InvalidNotificationRequestException.class);
    assertThatThrownBy(() -> backend.enqueue(1L, NotificationChannel.EMAIL, null, "t"))
        .isInstanceOf(InvalidNotificationRequestException.class);
    assertThatThrownBy(
            () -> backend.enqueue(1L, NotificationChannel.EMAIL, Map.of(), "x".repeat(51)))
        .isInstanceOf(InvalidNotificationRequestException.class);
    verify(jobRepository, never()).insert(any());
  }

  @Test
  void storageFailurePropagatesToCaller() {
    when(preferenceRepository.findByRecipientId(1L)).thenReturn(Optional.empty());
    when(jobRepository.insert(any(NotificationJob.class)))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThatThrownBy(() -> backend.enqueue(1L, NotificationChannel.EMAIL, Map.of(), "t"))
        .isInstanceOf(DataAccessResourceFailureException.class)
        .hasMessageContaining("db down");
  }
}
