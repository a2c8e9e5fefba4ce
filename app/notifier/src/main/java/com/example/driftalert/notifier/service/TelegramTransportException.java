/*
 * どこで: Notifier サービス層
 * 何を: Telegram Bot API 呼び出し失敗を分類付きで表現する
 * なぜ: 再試行可否の判定と記録上の失敗分類を HTTP 詳細から切り離すため
 */
package com.example.driftalert.notifier.service;

import java.time.Duration;

public class TelegramTransportException extends RuntimeException {

  public enum Reason {
    NETWORK,
    TIMEOUT,
    RATE_LIMITED,
    INVALID_CREDENTIAL,
    BAD_REQUEST,
    REJECTED,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final transient Duration retryAfter;

  public TelegramTransportException(Reason reason, String message) {
    this(reason, message, null, null);
  }

  public TelegramTransportException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, cause);
  }

  public TelegramTransportException(
      Reason reason, String message, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.retryAfter = retryAfter;
  }

  public Reason reason() {
    return reason;
  }

  /** 429 応答が示した待機時間。記録用で、待機時間の決定には使わない。 */
  public Duration retryAfter() {
    return retryAfter;
  }
}
