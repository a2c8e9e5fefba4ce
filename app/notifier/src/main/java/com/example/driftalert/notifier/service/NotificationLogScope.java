package com.example.driftalert.notifier.service;

import com.example.driftalert.notifier.model.NotificationRecord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

/** 1 通知の処理中だけ MDC に通知 ID/ラン ID/環境を載せ、close で取り除く。 */
final class NotificationLogScope implements AutoCloseable {

  static final String NOTIFICATION_ID = "notification_id";
  static final String DRIFT_RUN_ID = "drift_run_id";
  static final String ENVIRONMENT = "environment";

  private final List<String> keys = new ArrayList<>();

  private NotificationLogScope() {}

  static NotificationLogScope open(NotificationRecord record) {
    final NotificationLogScope scope = new NotificationLogScope();
    scope.put(NOTIFICATION_ID, record.notificationId());
    scope.put(DRIFT_RUN_ID, record.event().runId());
    scope.put(ENVIRONMENT, record.event().environment());
    return scope;
  }

  private void put(String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }

  @Override
  public void close() {
    for (String key : keys) {
      MDC.remove(key);
    }
  }
}
