/*
 * どこで: Notifier サービス層
 * 何を: メッセージ送信とボット識別の抽象
 * なぜ: 配信制御を HTTP 実装から切り離し、テストで送信結果を差し替えるため
 */
package com.example.driftalert.notifier.service;

import com.example.driftalert.notifier.service.dto.BotIdentity;

public interface TelegramTransport {

  /**
   * 1 メッセージを送信し、プラットフォームが払い出したメッセージ ID を返す。
   *
   * @throws TelegramTransportException 送信に失敗した場合
   */
  long sendMessage(String channelId, String text, boolean useMarkup);

  /**
   * 資格情報が有効なボットを指しているか確認する。
   *
   * @throws TelegramTransportException 確認に失敗した場合
   */
  BotIdentity identify();
}
