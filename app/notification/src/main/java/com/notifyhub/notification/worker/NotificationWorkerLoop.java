/*
 * どこで: Notification 配信ワーカー
 * 何を: 専用スレッドで配信バッチを一定間隔で回し続ける
 * なぜ: 予期しない例外でもプロセスを落とさず、長めの間隔で再試行するため
 */
package com.notifyhub.notification.worker;

import com.google.common.annotations.VisibleForTesting;
import com.notifyhub.notification.config.NotificationWorkerProperties;
import com.notifyhub.notification.service.NotificationDeliveryService;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationWorkerLoop implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(NotificationWorkerLoop.class);
  private static final long STOP_TIMEOUT_MILLIS = 30_000L;

  private final NotificationDeliveryService deliveryService;
  private final NotificationWorkerProperties properties;
  private final Sleeper sleeper;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean sleeping = new AtomicBoolean(false);
  private volatile Thread workerThread;

  @Autowired
  public NotificationWorkerLoop(
      NotificationDeliveryService deliveryService, NotificationWorkerProperties properties) {
    this(deliveryService, properties, Sleeper.THREAD);
  }

  NotificationWorkerLoop(
      NotificationDeliveryService deliveryService,
      NotificationWorkerProperties properties,
      Sleeper sleeper) {
    this.deliveryService = deliveryService;
    this.properties = properties;
    this.sleeper = sleeper;
  }

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    Thread thread = new Thread(this::runLoop, "notification-worker");
    thread.setDaemon(true);
    workerThread = thread;
    thread.start();
    logger.info(
        "notification worker started pollInterval={} errorRetryInterval={}",
        properties.pollInterval(),
        properties.errorRetryInterval());
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    Thread thread = workerThread;
    if (thread == null) {
      return;
    }
    // 送信中のジョブは完了させたいので、待機中のみ割り込みで起こす
    if (sleeping.get()) {
      thread.interrupt();
    }
    try {
      thread.join(STOP_TIMEOUT_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    workerThread = null;
    logger.info("notification worker stopped");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public boolean isAutoStartup() {
    // run-once モードでは RunOnceWorkerRunner が 1 バッチだけ処理する
    return !properties.runOnce();
  }

  private void runLoop() {
    while (running.get()) {
      Duration delay = runIteration();
      if (!running.get()) {
        return;
      }
      sleeping.set(true);
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      } finally {
        sleeping.set(false);
      }
    }
  }

  /** 1 バッチ処理し、次のバッチまでの待機時間を返す。 */
  @VisibleForTesting
  Duration runIteration() {
    try {
      deliveryService.processPendingBatch();
      return properties.pollInterval();
    } catch (RuntimeException ex) {
      logger.error(
          "notification worker batch failed; retrying after {}", properties.errorRetryInterval(), ex);
      return properties.errorRetryInterval();
    }
  }
}
