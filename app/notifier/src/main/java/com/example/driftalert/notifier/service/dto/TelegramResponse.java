package com.example.driftalert.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Bot API の共通レスポンス封筒。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramResponse<T>(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("result") T result,
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("description") String description,
    @JsonProperty("parameters") Parameters parameters) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Parameters(@JsonProperty("retry_after") Integer retryAfter) {}
}
