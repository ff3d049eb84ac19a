/*
 * どこで: Notification 配信ワーカー
 * 何を: lease 切れの SENDING ジョブを失敗 1 回として状態機械へ戻す
 * なぜ: 送信中にワーカーが落ちたジョブを SENDING のまま放置しないため
 */
package com.notifyhub.notification.worker;

import com.notifyhub.notification.config.NotificationDeliveryProperties;
import com.notifyhub.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.reconcile-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SendingLeaseReconciler {

  static final String LEASE_EXPIRED_REASON = "delivery lease expired";

  private static final Logger logger = LoggerFactory.getLogger(SendingLeaseReconciler.class);

  private final NotificationJobRepository jobRepository;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${notification.delivery.reconcile-interval}")
  public void reconcile() {
    Instant now = Instant.now(clock);
    try {
      int recovered =
          jobRepository.recoverExpiredLeases(
              now, now.plus(properties.retryBackoff()), LEASE_EXPIRED_REASON);
      if (recovered > 0) {
        logger.warn("expired sending leases recovered count={}", recovered);
      }
    } catch (DataAccessException ex) {
      // 次回の実行で再度回収を試みる
      logger.warn("failed to recover expired sending leases", ex);
    }
  }
}
