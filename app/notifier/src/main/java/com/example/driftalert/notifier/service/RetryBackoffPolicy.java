/*
 * どこで: Notifier サービス層
 * 何を: 試行回数ごとの待機時間と再試行可否を決める
 * なぜ: 指数バックオフの計算を送信ループから分離し、単体で検証できるようにするため
 */
package com.example.driftalert.notifier.service;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record RetryBackoffPolicy(
    int maxRetries, Duration initialDelay, double multiplier, Duration maxDelay) {

  private static final Set<TelegramTransportException.Reason> RETRYABLE =
      EnumSet.of(
          TelegramTransportException.Reason.NETWORK,
          TelegramTransportException.Reason.TIMEOUT,
          TelegramTransportException.Reason.RATE_LIMITED);

  public RetryBackoffPolicy {
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
    }
  }

  public static RetryBackoffPolicy defaults() {
    return new RetryBackoffPolicy(3, Duration.ofSeconds(2), 2.0d, Duration.ofSeconds(8));
  }

  /** attempt(0 始まり)回目の失敗後に待つ時間。initialDelay * multiplier^attempt を maxDelay で頭打ちにする。 */
  public Duration delay(int attempt) {
    final double exp = initialDelay.toMillis() * Math.pow(multiplier, Math.max(attempt, 0));
    final double capped = Math.min(exp, maxDelay.toMillis());
    return Duration.ofMillis((long) Math.ceil(capped));
  }

  public boolean isRetryable(TelegramTransportException.Reason reason) {
    return RETRYABLE.contains(reason);
  }

  /** 1 メッセージ片が再試行で待ち得る時間の合計。最終試行の後は待たない。 */
  public Duration totalRetryWindow() {
    Duration total = Duration.ZERO;
    for (int attempt = 0; attempt < maxRetries - 1; attempt++) {
      total = total.plus(delay(attempt));
    }
    return total;
  }
}
