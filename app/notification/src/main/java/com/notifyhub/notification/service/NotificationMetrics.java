/*
 * どこで: Notification サービス層
 * 何を: 配信結果/E2E遅延/backlog/enqueue 結果/realtime セッション数のメトリクスを記録する
 * なぜ: キューの滞留と配信失敗を Prometheus から直接観測できるようにするため
 */
package com.notifyhub.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  public static final String RESULT_SENT = "sent";
  public static final String RESULT_RETRY = "retry";
  public static final String RESULT_FAILED = "failed";
  public static final String RESULT_UNROUTABLE = "unroutable";
  public static final String RESULT_LOCK_LOST = "lock_lost";
  public static final String ENQUEUE_ACCEPTED = "accepted";
  public static final String ENQUEUE_SKIPPED = "skipped";

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_DELIVERY_E2E_DELAY = "notification.delivery.e2e.delay";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  private static final String METRIC_ENQUEUE_TOTAL = "notification.enqueue.total";
  private static final String METRIC_REALTIME_SESSIONS = "notification.realtime.sessions";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final AtomicInteger realtimeSessions = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> enqueueCounters = new ConcurrentHashMap<>();
  private final Timer deliveryE2eDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending notification jobs")
        .register(meterRegistry);
    Gauge.builder(METRIC_REALTIME_SESSIONS, realtimeSessions, AtomicInteger::get)
        .description("Live realtime sessions held by this process")
        .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("End-to-end delay from job created_at to sent_at")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordEnqueueResult(String result) {
    enqueueCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_ENQUEUE_TOTAL)
                    .description("Notification enqueue outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryE2eDelay(Instant createdAt, Instant sentAt) {
    if (createdAt == null || sentAt == null || sentAt.isBefore(createdAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(createdAt, sentAt));
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  public void updateRealtimeSessions(int sessionCount) {
    realtimeSessions.set(Math.max(sessionCount, 0));
  }
}
