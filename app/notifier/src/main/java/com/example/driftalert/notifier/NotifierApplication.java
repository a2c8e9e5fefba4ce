/*
 * どこで: Notifier アプリのエントリポイント
 * 何を: Spring Boot を非 Web で起動し、drift-notify の終了コードでプロセスを終える
 * なぜ: 設定不正を含む全ての失敗を終了コード 1 に揃え、CI から判定できるようにするため
 */
package com.example.driftalert.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.core.NestedExceptionUtils;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NotifierApplication {

  private static final Logger logger = LoggerFactory.getLogger(NotifierApplication.class);

  public static void main(String[] args) {
    int exitCode;
    try {
      exitCode = SpringApplication.exit(SpringApplication.run(NotifierApplication.class, args));
    } catch (RuntimeException ex) {
      // 設定検証の違反一覧は例外メッセージに含まれる
      logger.error(
          "drift notifier failed to start: {}",
          NestedExceptionUtils.getMostSpecificCause(ex).getMessage());
      exitCode = 1;
    }
    System.exit(exitCode);
  }
}
