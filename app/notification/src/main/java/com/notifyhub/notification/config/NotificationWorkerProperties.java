/*
 * どこで: Notification アプリの設定バインド
 * 何を: ワーカーループの起動可否/run-once/ポーリング間隔を保持する
 * なぜ: 同一成果物をワーカー常駐・単発実行・realtime 専用で切り替えるため
 */
package com.notifyhub.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.worker")
@Validated
public record NotificationWorkerProperties(
    boolean enabled,
    boolean runOnce,
    @NotNull Duration pollInterval,
    @NotNull Duration errorRetryInterval) {

  @AssertTrue(message = "notification.worker.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "notification.worker.error-retry-interval must be positive")
  public boolean isErrorRetryIntervalPositive() {
    return isPositiveDuration(errorRetryInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
