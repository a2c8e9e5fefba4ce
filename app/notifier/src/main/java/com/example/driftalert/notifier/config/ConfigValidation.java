package com.example.driftalert.notifier.config;

import com.example.driftalert.common.DriftValidationException;
import java.util.List;

/** 設定検証の結果。違反が無い場合のみ settings が入る。 */
public record ConfigValidation(NotificationSettings settings, List<String> violations) {

  public ConfigValidation {
    violations = List.copyOf(violations);
  }

  static ConfigValidation valid(NotificationSettings settings) {
    return new ConfigValidation(settings, List.of());
  }

  static ConfigValidation invalid(List<String> violations) {
    return new ConfigValidation(null, violations);
  }

  public boolean isValid() {
    return violations.isEmpty();
  }

  public NotificationSettings orElseThrow() {
    if (!isValid()) {
      throw new DriftValidationException("invalid notifier configuration", violations);
    }
    return settings;
  }
}
