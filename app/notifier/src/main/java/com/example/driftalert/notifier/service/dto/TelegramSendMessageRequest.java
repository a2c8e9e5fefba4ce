package com.example.driftalert.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelegramSendMessageRequest(
    @JsonProperty("chat_id") String chatId,
    @JsonProperty("text") String text,
    @JsonProperty("parse_mode") String parseMode) {}
