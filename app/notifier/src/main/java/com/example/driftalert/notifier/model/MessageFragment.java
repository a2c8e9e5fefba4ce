/*
 * どこで: Notifier ドメインモデル
 * 何を: 分割後の 1 メッセージ片(番号/総数/本文/送信後のリモート ID)を保持する
 * なぜ: 分割結果と送信結果を片ごとに追跡するため
 */
package com.example.driftalert.notifier.model;

import java.util.Objects;

public record MessageFragment(int partNumber, int totalParts, String content, Long remoteMessageId) {

  public MessageFragment {
    Objects.requireNonNull(content, "content");
    if (partNumber < 1 || totalParts < 1 || partNumber > totalParts) {
      throw new IllegalArgumentException(
          "invalid part position " + partNumber + "/" + totalParts);
    }
  }

  public static MessageFragment unsent(int partNumber, int totalParts, String content) {
    return new MessageFragment(partNumber, totalParts, content, null);
  }

  public MessageFragment withRemoteMessageId(long messageId) {
    return new MessageFragment(partNumber, totalParts, content, messageId);
  }

  public boolean isSent() {
    return remoteMessageId != null;
  }

  public boolean isLast() {
    return partNumber == totalParts;
  }
}
