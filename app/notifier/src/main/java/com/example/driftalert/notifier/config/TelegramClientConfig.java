/*
 * どこで: Notifier 設定
 * 何を: Telegram Bot API 呼び出し専用 RestClient を提供する
 * なぜ: 接続先とタイムアウトを設定から決め、テストではモックサーバーへ差し替えるため
 */
package com.example.driftalert.notifier.config;

import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(TelegramClientProperties.class)
public class TelegramClientConfig {

  @Bean
  RestClient telegramRestClient(RestClient.Builder builder, TelegramClientProperties properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
