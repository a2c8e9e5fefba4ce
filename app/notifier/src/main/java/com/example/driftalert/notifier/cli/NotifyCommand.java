/*
 * どこで: Notifier CLI
 * 何を: drift-notify コマンドの引数を受け取り、レポート読込から配信までを 1 回実行する
 * なぜ: CI ジョブから呼ばれ、結果を終了コード(0/1)だけで判定できるようにするため
 */
package com.example.driftalert.notifier.cli;

import com.example.driftalert.common.DriftValidationException;
import com.example.driftalert.common.event.DriftEvent;
import com.example.driftalert.common.report.DriftReportNotFoundException;
import com.example.driftalert.common.report.DriftReportReader;
import com.example.driftalert.notifier.config.NotificationSettings;
import com.example.driftalert.notifier.model.DeliveryStatus;
import com.example.driftalert.notifier.model.NotificationRecord;
import com.example.driftalert.notifier.service.NotificationDeliveryService;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Component
@RequiredArgsConstructor
@Command(
    name = "drift-notify",
    mixinStandardHelpOptions = true,
    description = "Send an infrastructure drift report to the configured Telegram channel")
public class NotifyCommand implements Callable<Integer> {

  private static final Logger logger = LoggerFactory.getLogger(NotifyCommand.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  @Option(
      names = "--report",
      required = true,
      description = "Path to the drift report JSON file")
  private Path report;

  @Option(names = "--environment", description = "Override the environment name in the report")
  private String environment;

  @Option(names = "--run-id", description = "Workflow run id used in the notification id")
  private String runId;

  private final DriftReportReader reportReader;
  private final NotificationDeliveryService deliveryService;
  private final NotificationSettings settings;

  @Override
  public Integer call() {
    logger.info("drift notifier starting config={}", settings.sanitizedForLogging());
    try {
      DriftEvent event = reportReader.read(report);
      if (environment != null && !environment.isBlank()) {
        event = event.withEnvironment(environment);
      }
      final NotificationRecord record =
          deliveryService.deliverWithin(event, runId, settings.deliveryDeadline());
      if (record.status() == DeliveryStatus.SENT) {
        logger.info(
            "drift notification completed id={} fragments={}",
            record.notificationId(),
            record.sentFragmentCount());
        return EXIT_OK;
      }
      logger.error(
          "drift notification failed id={} status={} error={}",
          record.notificationId(),
          record.status(),
          record.lastError());
      return EXIT_FAILURE;
    } catch (DriftReportNotFoundException ex) {
      logger.error("drift report not found path={}", report);
      return EXIT_FAILURE;
    } catch (DriftValidationException ex) {
      logger.error(
          "drift report is invalid subject={} violations={}", ex.subject(), ex.violations());
      return EXIT_FAILURE;
    } catch (RuntimeException ex) {
      logger.error("drift notifier failed unexpectedly", ex);
      return EXIT_FAILURE;
    }
  }

  /** 引数エラーも例外ではなく終了コード 1 として返す CommandLine を作る。 */
  public static CommandLine commandLine(NotifyCommand command) {
    final CommandLine commandLine = new CommandLine(command);
    commandLine.setParameterExceptionHandler(
        (ex, args) -> {
          logger.error("invalid arguments: {}", ex.getMessage());
          ex.getCommandLine().usage(ex.getCommandLine().getErr());
          return EXIT_FAILURE;
        });
    return commandLine;
  }
}
