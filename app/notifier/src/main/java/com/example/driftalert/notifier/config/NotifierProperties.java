/*
 * どこで: Notifier アプリの設定バインド
 * 何を: Telegram 通知の認証情報/リトライ/整形設定を保持する
 * なぜ: 運用パラメータを環境変数から外部化し、既定値をここに集約するため
 */
package com.example.driftalert.notifier.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

@ConfigurationProperties(prefix = "drift.notifier")
public record NotifierProperties(
    String botToken,
    String channelId,
    Integer maxRetries,
    // 単位無しの値は秒として扱う
    @DurationUnit(ChronoUnit.SECONDS) Duration initialRetryDelay,
    Double retryMultiplier,
    @DurationUnit(ChronoUnit.SECONDS) Duration maxRetryDelay,
    Boolean enableMarkdown,
    Integer maxMessageLength,
    Boolean splitOnResourceBoundary,
    Boolean notifyOnNoDrift,
    Boolean includeWorkflowLink,
    Duration fragmentPacing,
    @DurationUnit(ChronoUnit.SECONDS) Duration deliveryDeadline,
    Integer errorMessageMaxLength) {

  public NotifierProperties {
    botToken = botToken == null ? "" : botToken.trim();
    channelId = channelId == null ? "" : channelId.trim();
    maxRetries = maxRetries == null ? 3 : maxRetries;
    initialRetryDelay = initialRetryDelay == null ? Duration.ofSeconds(2) : initialRetryDelay;
    retryMultiplier = retryMultiplier == null ? 2.0d : retryMultiplier;
    maxRetryDelay = maxRetryDelay == null ? Duration.ofSeconds(8) : maxRetryDelay;
    enableMarkdown = enableMarkdown == null ? Boolean.TRUE : enableMarkdown;
    maxMessageLength = maxMessageLength == null ? 4096 : maxMessageLength;
    splitOnResourceBoundary =
        splitOnResourceBoundary == null ? Boolean.TRUE : splitOnResourceBoundary;
    notifyOnNoDrift = notifyOnNoDrift == null ? Boolean.FALSE : notifyOnNoDrift;
    includeWorkflowLink = includeWorkflowLink == null ? Boolean.TRUE : includeWorkflowLink;
    fragmentPacing = fragmentPacing == null ? Duration.ofMillis(100) : fragmentPacing;
    deliveryDeadline = deliveryDeadline == null ? Duration.ofSeconds(60) : deliveryDeadline;
    errorMessageMaxLength = errorMessageMaxLength == null ? 1000 : errorMessageMaxLength;
  }

  @Override
  public String toString() {
    // 既定の record toString はトークンを平文で出すため上書きする
    return "NotifierProperties[botToken="
        + NotificationSettings.maskToken(botToken)
        + ", channelId="
        + channelId
        + ", maxRetries="
        + maxRetries
        + "]";
  }
}
