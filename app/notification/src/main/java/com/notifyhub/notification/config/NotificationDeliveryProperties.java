/*
 * どこで: Notification アプリの設定バインド
 * 何を: claim バッチ/リトライ上限/バックオフ/lease の設定を保持する
 * なぜ: 配信状態機械の運用パラメータを外部化し、起動時に妥当性を検証するため
 */
package com.notifyhub.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    @NotNull @Positive Integer batchSize,
    @NotNull @Positive Integer maxRetries,
    @NotNull Duration retryBackoff,
    // failed_reason 列 (VARCHAR(255)) を超えると状態更新自体が失敗する
    @NotNull @Positive @Max(255) Integer errorMessageMaxLength,
    @NotNull Duration lease,
    boolean reconcileEnabled,
    @NotNull Duration reconcileInterval) {

  @AssertTrue(message = "notification.delivery.retry-backoff must not be negative")
  public boolean isRetryBackoffValid() {
    // 0 は即時再試行として許容する
    return retryBackoff != null && !retryBackoff.isNegative();
  }

  @AssertTrue(message = "notification.delivery.lease must be positive")
  public boolean isLeasePositive() {
    return isPositiveDuration(lease);
  }

  @AssertTrue(message = "notification.delivery.reconcile-interval must be positive")
  public boolean isReconcileIntervalPositive() {
    return isPositiveDuration(reconcileInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
