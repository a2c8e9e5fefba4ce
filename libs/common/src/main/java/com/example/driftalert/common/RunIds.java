package com.example.driftalert.common;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

public final class RunIds {

  private static final DateTimeFormatter NOTIFICATION_SUFFIX =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private RunIds() {}

  public static String newRunId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }

  public static String notificationId(String runId, Instant createdAt) {
    return "drift_" + runId + "_" + NOTIFICATION_SUFFIX.format(createdAt);
  }
}
