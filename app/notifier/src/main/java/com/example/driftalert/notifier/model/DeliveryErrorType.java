/*
 * どこで: Notifier ドメインモデル
 * 何を: 配信失敗の分類を定義する
 * なぜ: 失敗理由を例外型名ではなく閉じた列挙で記録し、終了判定とログを安定させるため
 */
package com.example.driftalert.notifier.model;

import com.example.driftalert.notifier.service.TelegramTransportException;

public enum DeliveryErrorType {
  NETWORK,
  TIMEOUT,
  RATE_LIMITED,
  INVALID_CREDENTIAL,
  BAD_REQUEST,
  REJECTED,
  INVALID_RESPONSE,
  SIZE_VIOLATION,
  DEADLINE_EXCEEDED,
  UNEXPECTED;

  public static DeliveryErrorType from(TelegramTransportException.Reason reason) {
    return switch (reason) {
      case NETWORK -> NETWORK;
      case TIMEOUT -> TIMEOUT;
      case RATE_LIMITED -> RATE_LIMITED;
      case INVALID_CREDENTIAL -> INVALID_CREDENTIAL;
      case BAD_REQUEST -> BAD_REQUEST;
      case REJECTED -> REJECTED;
      case INVALID_RESPONSE -> INVALID_RESPONSE;
    };
  }
}
