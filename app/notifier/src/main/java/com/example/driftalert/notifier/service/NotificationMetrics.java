/*
 * どこで: Notifier サービス層
 * 何を: 配信結果/試行結果/片数/所要時間のアプリ固有メトリクスを記録する
 * なぜ: 再試行の多発や分割数の増加を外部から観測できるようにするため
 */
package com.example.driftalert.notifier.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "drift.notification.delivery.total";
  private static final String METRIC_ATTEMPT_TOTAL = "drift.notification.attempt.total";
  private static final String METRIC_FRAGMENTS = "drift.notification.fragments";
  private static final String METRIC_DELIVERY_DURATION = "drift.notification.delivery.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
  private final DistributionSummary fragmentSummary;
  private final Timer deliveryDurationTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.fragmentSummary =
        DistributionSummary.builder(METRIC_FRAGMENTS)
            .description("Number of fragments a notification was split into")
            .register(meterRegistry);
    this.deliveryDurationTimer =
        Timer.builder(METRIC_DELIVERY_DURATION)
            .description("Duration from notification creation to its terminal status")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Drift notification delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAttempt(String outcome) {
    attemptCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_ATTEMPT_TOTAL)
                    .description("Telegram send attempt outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordFragments(int fragmentCount) {
    if (fragmentCount < 0) {
      return;
    }
    fragmentSummary.record(fragmentCount);
  }

  public void recordDeliveryDuration(Instant startedAt, Instant finishedAt) {
    if (startedAt == null || finishedAt == null || finishedAt.isBefore(startedAt)) {
      return;
    }
    deliveryDurationTimer.record(Duration.between(startedAt, finishedAt));
  }
}
