package com.example.driftalert.notifier.service;

import java.time.Duration;

/** 再試行待機と片間の間隔待機を差し替え可能にする。 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> {
      if (!duration.isZero() && !duration.isNegative()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }
}
