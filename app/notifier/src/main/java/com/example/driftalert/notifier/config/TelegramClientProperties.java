/*
 * どこで: Notifier 設定
 * 何を: Telegram Bot API 呼び出し設定(baseUrl/パス/タイムアウト)を保持する
 * なぜ: テストやプロキシ環境で接続先とタイムアウトを差し替えられるようにするため
 */
package com.example.driftalert.notifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "drift.telegram")
public record TelegramClientProperties(
    String baseUrl,
    String sendMessagePath,
    String getMePath,
    Duration connectTimeout,
    Duration readTimeout) {

  public TelegramClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.telegram.org" : baseUrl;
    sendMessagePath =
        sendMessagePath == null || sendMessagePath.isBlank()
            ? "/bot{token}/sendMessage"
            : sendMessagePath;
    getMePath = getMePath == null || getMePath.isBlank() ? "/bot{token}/getMe" : getMePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
