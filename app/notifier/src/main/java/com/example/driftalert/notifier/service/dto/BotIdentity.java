package com.example.driftalert.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BotIdentity(
    @JsonProperty("id") Long id,
    @JsonProperty("username") String username,
    @JsonProperty("is_bot") Boolean bot) {}
