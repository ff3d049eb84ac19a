/*
 * どこで: Notification 配信ワーカー
 * 何を: run-once モードで 1 バッチだけ処理する
 * なぜ: 運用やテストで現在のバッチだけを流して終了できるようにするため
 */
package com.notifyhub.notification.worker;

import com.notifyhub.notification.service.NotificationDeliveryService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.worker.run-once", havingValue = "true")
public class RunOnceWorkerRunner implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(RunOnceWorkerRunner.class);

  private final NotificationDeliveryService deliveryService;

  @Override
  public void run(ApplicationArguments args) {
    int claimed = deliveryService.processPendingBatch();
    logger.info("notification worker run-once finished claimed={}", claimed);
  }
}
