/*
 * どこで: Notifier サービス層
 * 何を: Telegram Bot API の sendMessage/getMe を呼び出し、失敗を分類して返す
 * なぜ: HTTP ステータスや I/O 例外を配信制御が扱える閉じた分類へ一貫変換するため
 */
package com.example.driftalert.notifier.service;

import com.example.driftalert.notifier.config.NotificationSettings;
import com.example.driftalert.notifier.config.TelegramClientProperties;
import com.example.driftalert.notifier.service.dto.BotIdentity;
import com.example.driftalert.notifier.service.dto.TelegramMessage;
import com.example.driftalert.notifier.service.dto.TelegramResponse;
import com.example.driftalert.notifier.service.dto.TelegramSendMessageRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class TelegramBotClient implements TelegramTransport {

  private static final Logger logger = LoggerFactory.getLogger(TelegramBotClient.class);

  static final String PARSE_MODE = "MarkdownV2";
  static final String TOKEN_PLACEHOLDER = "{token}";

  private static final ParameterizedTypeReference<TelegramResponse<TelegramMessage>>
      MESSAGE_RESPONSE = new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<TelegramResponse<BotIdentity>>
      IDENTITY_RESPONSE = new ParameterizedTypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient telegramRestClient;

  private final TelegramClientProperties properties;
  private final NotificationSettings settings;

  public TelegramBotClient(
      RestClient telegramRestClient,
      TelegramClientProperties properties,
      NotificationSettings settings) {
    this.telegramRestClient = telegramRestClient;
    this.properties = properties;
    this.settings = settings;
  }

  @Override
  public long sendMessage(String channelId, String text, boolean useMarkup) {
    if (isBlank(channelId)) {
      throw new IllegalArgumentException("channelId is required");
    }
    if (isBlank(text)) {
      throw new IllegalArgumentException("text is required");
    }
    final TelegramSendMessageRequest request =
        new TelegramSendMessageRequest(channelId, text, useMarkup ? PARSE_MODE : null);
    try {
      return requireMessageId(
          telegramRestClient
              .post()
              .uri(botPath(properties.sendMessagePath()))
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(MESSAGE_RESPONSE));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "sendMessage");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "sendMessage");
    } catch (TelegramTransportException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("telegram sendMessage response parse failed type={}", ex.getClass().getName());
      throw new TelegramTransportException(
          TelegramTransportException.Reason.INVALID_RESPONSE, "telegram response parse failed", ex);
    }
  }

  @Override
  public BotIdentity identify() {
    try {
      return requireIdentity(
          telegramRestClient
              .get()
              .uri(botPath(properties.getMePath()))
              .retrieve()
              .body(IDENTITY_RESPONSE));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "getMe");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "getMe");
    } catch (TelegramTransportException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("telegram getMe response parse failed type={}", ex.getClass().getName());
      throw new TelegramTransportException(
          TelegramTransportException.Reason.INVALID_RESPONSE, "telegram response parse failed", ex);
    }
  }

  // URI 変数として渡すと ':' がエンコードされるため、トークンはパスへ直接埋め込む
  private String botPath(String template) {
    return template.replace(TOKEN_PLACEHOLDER, settings.botToken());
  }

  private long requireMessageId(TelegramResponse<TelegramMessage> response) {
    if (response == null
        || !response.ok()
        || response.result() == null
        || response.result().messageId() == null) {
      throw new TelegramTransportException(
          TelegramTransportException.Reason.INVALID_RESPONSE,
          "telegram sendMessage response is invalid");
    }
    return response.result().messageId();
  }

  private BotIdentity requireIdentity(TelegramResponse<BotIdentity> response) {
    if (response == null || !response.ok() || response.result() == null) {
      throw new TelegramTransportException(
          TelegramTransportException.Reason.INVALID_RESPONSE, "telegram getMe response is invalid");
    }
    return response.result();
  }

  private TelegramTransportException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "telegram {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 401 || status == 404) {
      return new TelegramTransportException(
          TelegramTransportException.Reason.INVALID_CREDENTIAL,
          "telegram rejected bot credential status=" + status,
          ex);
    }
    if (status == 400) {
      return new TelegramTransportException(
          TelegramTransportException.Reason.BAD_REQUEST,
          "telegram rejected request: " + describe(ex),
          ex);
    }
    if (status == 403) {
      return new TelegramTransportException(
          TelegramTransportException.Reason.REJECTED,
          "telegram denied access to channel: " + describe(ex),
          ex);
    }
    if (status == 429) {
      return new TelegramTransportException(
          TelegramTransportException.Reason.RATE_LIMITED,
          "telegram rate limited request",
          retryAfter(ex),
          ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new TelegramTransportException(
          TelegramTransportException.Reason.NETWORK, "telegram server error status=" + status, ex);
    }
    return new TelegramTransportException(
        TelegramTransportException.Reason.REJECTED, "telegram request failed status=" + status, ex);
  }

  // ResourceAccessException のメッセージは URL(=トークン)を含むため、原因例外だけを残す
  private TelegramTransportException mapResourceException(
      ResourceAccessException ex, String operation) {
    final Throwable cause = ex.getMostSpecificCause();
    if (isTimeout(ex)) {
      logger.warn("telegram {} timed out", operation);
      return new TelegramTransportException(
          TelegramTransportException.Reason.TIMEOUT, "telegram request timeout", cause);
    }
    logger.warn(
        "telegram {} connection failed type={}", operation, cause.getClass().getName());
    return new TelegramTransportException(
        TelegramTransportException.Reason.NETWORK,
        "telegram connection failed: " + cause.getClass().getSimpleName(),
        cause);
  }

  private String describe(RestClientResponseException ex) {
    final TelegramResponse<?> body = errorBody(ex);
    if (body == null || isBlank(body.description())) {
      return ex.getStatusText();
    }
    return body.description();
  }

  private Duration retryAfter(RestClientResponseException ex) {
    final TelegramResponse<?> body = errorBody(ex);
    if (body == null || body.parameters() == null || body.parameters().retryAfter() == null) {
      return null;
    }
    return Duration.ofSeconds(body.parameters().retryAfter());
  }

  private TelegramResponse<?> errorBody(RestClientResponseException ex) {
    try {
      return ex.getResponseBodyAs(TelegramResponse.class);
    } catch (RuntimeException parseFailure) {
      logger.debug("telegram error body could not be parsed", parseFailure);
      return null;
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
