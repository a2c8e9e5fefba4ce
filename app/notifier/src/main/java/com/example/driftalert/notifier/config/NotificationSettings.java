/*
 * どこで: Notifier 設定
 * 何を: 検証済みの通知設定を保持し、境界での一回限りの検証を提供する
 * なぜ: 不正なトークン/チャンネル ID/長さ上限を送信処理へ持ち込まないため
 */
package com.example.driftalert.notifier.config;

import com.example.driftalert.notifier.format.MessageSplitter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NotificationSettings(
    String botToken,
    String channelId,
    int maxRetries,
    Duration initialRetryDelay,
    double retryMultiplier,
    Duration maxRetryDelay,
    boolean markdownEnabled,
    int maxMessageLength,
    boolean splitOnResourceBoundary,
    boolean notifyOnNoDrift,
    boolean includeWorkflowLink,
    Duration fragmentPacing,
    Duration deliveryDeadline,
    int errorMessageMaxLength) {

  public static final int MIN_TOKEN_LENGTH = 20;
  public static final int MIN_RETRIES = 1;
  public static final int MAX_RETRIES = 5;
  public static final int PLATFORM_MAX_MESSAGE_LENGTH = 4096;

  private static final int MASK_VISIBLE_CHARS = 4;
  private static final String REDACTED = "[REDACTED]";

  /**
   * 役割: バインド済みプロパティを検証し、違反一覧または検証済み設定を返す。
   * 動作: 各不変条件を一度ずつ確認し、違反は全件収集する(最初の違反で止めない)。
   */
  public static ConfigValidation validate(NotifierProperties properties) {
    final List<String> violations = new ArrayList<>();
    validateBotToken(properties.botToken(), violations);
    validateChannelId(properties.channelId(), violations);
    if (properties.maxRetries() < MIN_RETRIES || properties.maxRetries() > MAX_RETRIES) {
      violations.add("maxRetries must be between 1 and 5: " + properties.maxRetries());
    }
    if (!isPositive(properties.initialRetryDelay())) {
      violations.add("initialRetryDelay must be positive");
    }
    if (properties.retryMultiplier() < 1.0d) {
      violations.add("retryMultiplier must be >= 1: " + properties.retryMultiplier());
    }
    if (!isPositive(properties.maxRetryDelay())
        || (isPositive(properties.initialRetryDelay())
            && properties.maxRetryDelay().compareTo(properties.initialRetryDelay()) < 0)) {
      violations.add("maxRetryDelay must be positive and >= initialRetryDelay");
    }
    if (properties.maxMessageLength() <= MessageSplitter.RESERVED_BUFFER
        || properties.maxMessageLength() > PLATFORM_MAX_MESSAGE_LENGTH) {
      violations.add(
          "maxMessageLength must be greater than "
              + MessageSplitter.RESERVED_BUFFER
              + " and at most "
              + PLATFORM_MAX_MESSAGE_LENGTH
              + ": "
              + properties.maxMessageLength());
    }
    if (properties.fragmentPacing().isNegative()) {
      violations.add("fragmentPacing must not be negative");
    }
    if (!isPositive(properties.deliveryDeadline())) {
      violations.add("deliveryDeadline must be positive");
    }
    if (properties.errorMessageMaxLength() < 1) {
      violations.add("errorMessageMaxLength must be positive");
    }
    if (!violations.isEmpty()) {
      return ConfigValidation.invalid(violations);
    }
    return ConfigValidation.valid(
        new NotificationSettings(
            properties.botToken(),
            properties.channelId(),
            properties.maxRetries(),
            properties.initialRetryDelay(),
            properties.retryMultiplier(),
            properties.maxRetryDelay(),
            properties.enableMarkdown(),
            properties.maxMessageLength(),
            properties.splitOnResourceBoundary(),
            properties.notifyOnNoDrift(),
            properties.includeWorkflowLink(),
            properties.fragmentPacing(),
            properties.deliveryDeadline(),
            properties.errorMessageMaxLength()));
  }

  private static void validateBotToken(String token, List<String> violations) {
    // 違反メッセージにトークン本体を含めない
    if (token == null || token.isBlank()) {
      violations.add("botToken is required (TELEGRAM_BOT_TOKEN)");
      return;
    }
    if (token.length() < MIN_TOKEN_LENGTH) {
      violations.add("botToken must be at least " + MIN_TOKEN_LENGTH + " characters");
    }
    if (token.indexOf(':') < 0) {
      violations.add("botToken must contain ':' separator");
    }
  }

  private static void validateChannelId(String channelId, List<String> violations) {
    if (channelId == null || channelId.isBlank()) {
      violations.add("channelId is required (TELEGRAM_CHANNEL_ID)");
      return;
    }
    if (!(channelId.startsWith("@") || channelId.startsWith("-") || isDigits(channelId))) {
      violations.add("channelId must start with '@' or '-', or be numeric: " + channelId);
    }
  }

  private static boolean isDigits(String value) {
    return value.chars().allMatch(Character::isDigit);
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }

  /** 先頭/末尾 4 文字以外を伏せる。短すぎる値は全体を伏せる。 */
  public static String maskToken(String token) {
    if (token == null || token.length() <= MASK_VISIBLE_CHARS * 2 + 3) {
      return REDACTED;
    }
    return token.substring(0, MASK_VISIBLE_CHARS)
        + "..."
        + token.substring(token.length() - MASK_VISIBLE_CHARS);
  }

  public Map<String, Object> sanitizedForLogging() {
    final Map<String, Object> sanitized = new LinkedHashMap<>();
    sanitized.put("bot_token", maskToken(botToken));
    sanitized.put("channel_id", channelId);
    sanitized.put("max_retries", maxRetries);
    sanitized.put("initial_retry_delay", initialRetryDelay);
    sanitized.put("retry_multiplier", retryMultiplier);
    sanitized.put("max_retry_delay", maxRetryDelay);
    sanitized.put("enable_markdown", markdownEnabled);
    sanitized.put("max_message_length", maxMessageLength);
    sanitized.put("notify_on_no_drift", notifyOnNoDrift);
    return sanitized;
  }

  @Override
  public String toString() {
    return "NotificationSettings" + sanitizedForLogging();
  }
}
