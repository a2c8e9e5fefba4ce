package com.example.driftalert.notifier.model;

import java.util.Objects;

public record DeliveryError(DeliveryErrorType type, String message) {

  public DeliveryError {
    Objects.requireNonNull(type, "type");
    message = message == null ? "unknown error" : message;
  }
}
