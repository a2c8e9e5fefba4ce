/*
 * どこで: Notifier ドメインモデル
 * 何を: 1 回の送信試行の結果(成功/再試行可能な失敗/致命的な失敗)を表す
 * なぜ: 再試行判断を例外の捕捉位置ではなく値の分岐で行うため
 */
package com.example.driftalert.notifier.model;

public sealed interface DeliveryAttemptResult {

  record Success(long remoteMessageId) implements DeliveryAttemptResult {}

  record RetryableFailure(DeliveryErrorType type, String reason) implements DeliveryAttemptResult {}

  record FatalFailure(DeliveryErrorType type, String reason) implements DeliveryAttemptResult {}

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /** ログ/メトリクス用の短い結果名。 */
  default String outcome() {
    if (this instanceof Success) {
      return "success";
    }
    return this instanceof RetryableFailure ? "retryable_failure" : "fatal_failure";
  }
}
