/*
 * どこで: Notifier 設定
 * 何を: 検証済み通知設定/時計/待機/再試行ポリシー/レポート読込/ワーカースレッドを Bean として提供する
 * なぜ: 起動時に設定を一度だけ検証し、テストで Clock と Sleeper を差し替えられるようにするため
 */
package com.example.driftalert.notifier.config;

import com.example.driftalert.common.report.DriftReportReader;
import com.example.driftalert.notifier.service.RetryBackoffPolicy;
import com.example.driftalert.notifier.service.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(NotifierProperties.class)
public class NotifierConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  Sleeper sleeper() {
    return Sleeper.threadSleep();
  }

  @Bean
  NotificationSettings notificationSettings(NotifierProperties properties) {
    return NotificationSettings.validate(properties).orElseThrow();
  }

  @Bean
  RetryBackoffPolicy retryBackoffPolicy(NotificationSettings settings) {
    return new RetryBackoffPolicy(
        settings.maxRetries(),
        settings.initialRetryDelay(),
        settings.retryMultiplier(),
        settings.maxRetryDelay());
  }

  @Bean
  DriftReportReader driftReportReader(ObjectMapper objectMapper, Clock clock) {
    return new DriftReportReader(objectMapper, clock);
  }

  // 通知ごとに専用ワーカーで動かし、片の順序はワーカー内の逐次送信で守る
  @Bean(destroyMethod = "shutdownNow")
  ExecutorService notifierExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("drift-notify-%d").setDaemon(true).build());
  }
}
