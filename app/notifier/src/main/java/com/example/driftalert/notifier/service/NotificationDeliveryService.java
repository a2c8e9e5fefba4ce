/*
 * どこで: Notifier サービス層
 * 何を: DriftEvent を整形/分割し、メッセージ片を順番に送信して通知レコードの最終状態を決める
 * なぜ: 片ごとの再試行とレコード全体の再試行上限を一箇所で制御し、チャンネル上の順序を守るため
 */
package com.example.driftalert.notifier.service;

import com.example.driftalert.common.RunIds;
import com.example.driftalert.common.event.DriftEvent;
import com.example.driftalert.notifier.config.NotificationSettings;
import com.example.driftalert.notifier.format.DriftMessageComposer;
import com.example.driftalert.notifier.format.MessageSizeException;
import com.example.driftalert.notifier.format.MessageSplitter;
import com.example.driftalert.notifier.model.DeliveryAttemptResult;
import com.example.driftalert.notifier.model.DeliveryError;
import com.example.driftalert.notifier.model.DeliveryErrorType;
import com.example.driftalert.notifier.model.DeliveryStatus;
import com.example.driftalert.notifier.model.MessageFragment;
import com.example.driftalert.notifier.model.NotificationRecord;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ExecutorService/Clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);

  private final TelegramTransport transport;
  private final DriftMessageComposer composer;
  private final MessageSplitter splitter;
  private final RetryBackoffPolicy retryPolicy;
  private final NotificationSettings settings;
  private final NotificationMetrics metrics;
  private final Sleeper sleeper;
  private final Clock clock;
  private final ExecutorService notifierExecutor;

  /** 呼び出しスレッド上で 1 通知を最後まで処理する。 */
  public NotificationRecord deliver(DriftEvent event, String runId) {
    return deliver(newRecord(event, runId), record -> {});
  }

  /**
   * 役割: 通知処理をワーカースレッドで実行し、deadline を超えたら打ち切る。
   * 動作: 期限切れ時はワーカーへ割り込み、最後に観測したレコードを DEADLINE_EXCEEDED で FAILED にして返す。
   */
  public NotificationRecord deliverWithin(DriftEvent event, String runId, Duration deadline) {
    final NotificationRecord pending = newRecord(event, runId);
    final AtomicReference<NotificationRecord> latest = new AtomicReference<>(pending);
    final Future<NotificationRecord> future =
        notifierExecutor.submit(() -> deliver(pending, latest::set));
    try {
      return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.error(
          "notification delivery exceeded deadline id={} deadline={}",
          pending.notificationId(),
          deadline);
      return deadlineExceeded(latest.get(), "delivery exceeded deadline of " + deadline);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return deadlineExceeded(latest.get(), "delivery interrupted");
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("notification delivery failed", cause);
    }
  }

  @VisibleForTesting
  NotificationRecord deliver(NotificationRecord pending, Consumer<NotificationRecord> observer) {
    try (NotificationLogScope ignored = NotificationLogScope.open(pending)) {
      final NotificationRecord result = process(pending, observer);
      finish(result);
      return result;
    }
  }

  private NotificationRecord newRecord(DriftEvent event, String runId) {
    final Instant createdAt = clock.instant();
    final String resolvedRunId = isBlank(runId) ? RunIds.newRunId() : runId;
    return NotificationRecord.pending(
        RunIds.notificationId(resolvedRunId, createdAt), event, settings.channelId(), createdAt);
  }

  private NotificationRecord process(
      NotificationRecord pending, Consumer<NotificationRecord> observer) {
    final DriftEvent event = pending.event();
    if (!event.driftDetected() && !settings.notifyOnNoDrift()) {
      logger.info("no drift detected and no-drift notifications are disabled, skipping send");
      return observe(pending.sent(clock.instant()), observer);
    }

    final List<MessageFragment> fragments;
    try {
      final String message = composer.compose(event, settings.includeWorkflowLink());
      fragments =
          splitter.split(
              message, event, settings.maxMessageLength(), settings.splitOnResourceBoundary());
    } catch (MessageSizeException | IllegalArgumentException ex) {
      // 整形の失敗は送信前に通知全体を打ち切る
      logger.error("notification formatting failed", ex);
      return observe(
          pending.failed(error(DeliveryErrorType.SIZE_VIOLATION, ex.getMessage())), observer);
    }
    metrics.recordFragments(fragments.size());
    NotificationRecord record = observe(pending.withFragments(fragments).sending(), observer);
    logger.info(
        "notification prepared fragments={} totalLength={}",
        fragments.size(),
        record.totalMessageLength());

    final DeliveryAttemptResult identity = verifyIdentity();
    if (!identity.isSuccess()) {
      return observe(record.failed(errorOf(identity)), observer);
    }

    try {
      for (int index = 0; index < fragments.size(); index++) {
        record = sendFragment(record, index, observer);
        if (record.status() == DeliveryStatus.FAILED) {
          return record;
        }
        if (!record.fragments().get(index).isLast()) {
          // 片の到着順を保つため間隔を空ける
          sleeper.sleep(settings.fragmentPacing());
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("notification delivery interrupted sentFragments={}", record.sentFragmentCount());
      return observe(
          record.failed(error(DeliveryErrorType.DEADLINE_EXCEEDED, "delivery interrupted")),
          observer);
    }
    return observe(record.sent(clock.instant()), observer);
  }

  private NotificationRecord sendFragment(
      NotificationRecord start, int index, Consumer<NotificationRecord> observer)
      throws InterruptedException {
    NotificationRecord record = start;
    final MessageFragment fragment = record.fragments().get(index);
    for (int attempt = 0; ; attempt++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("delivery interrupted before attempt");
      }
      final DeliveryAttemptResult result = attemptSend(record.channelId(), fragment);
      metrics.recordAttempt(result.outcome());

      if (result instanceof DeliveryAttemptResult.Success success) {
        logger.info(
            "fragment sent part={}/{} messageId={}",
            fragment.partNumber(),
            fragment.totalParts(),
            success.remoteMessageId());
        return observe(record.withFragmentSent(index, success.remoteMessageId()), observer);
      }
      final DeliveryError error = errorOf(result);
      if (result instanceof DeliveryAttemptResult.FatalFailure) {
        logger.error(
            "fragment send failed permanently part={}/{} type={} reason={}",
            fragment.partNumber(),
            fragment.totalParts(),
            error.type(),
            error.message());
        return observe(record.failed(error), observer);
      }
      // 片ごとの試行上限とレコード全体の再試行上限のどちらかに達したら終了
      if (attempt + 1 >= retryPolicy.maxRetries()
          || record.retryCount() >= retryPolicy.maxRetries()) {
        logger.error(
            "fragment send retries exhausted part={}/{} attempts={} retryCount={} type={}",
            fragment.partNumber(),
            fragment.totalParts(),
            attempt + 1,
            record.retryCount(),
            error.type());
        return observe(record.failed(error), observer);
      }
      final Duration delay = retryPolicy.delay(attempt);
      record = observe(record.retrying(error), observer);
      logger.warn(
          "fragment send retry scheduled part={}/{} attempt={} delayMs={} type={}",
          fragment.partNumber(),
          fragment.totalParts(),
          attempt + 1,
          delay.toMillis(),
          error.type());
      sleeper.sleep(delay);
      record = observe(record.sending(), observer);
    }
  }

  @VisibleForTesting
  DeliveryAttemptResult attemptSend(String channelId, MessageFragment fragment) {
    try {
      return new DeliveryAttemptResult.Success(
          transport.sendMessage(channelId, fragment.content(), settings.markdownEnabled()));
    } catch (TelegramTransportException ex) {
      return classify(ex);
    } catch (RuntimeException ex) {
      logger.error("unexpected transport failure", ex);
      return new DeliveryAttemptResult.FatalFailure(
          DeliveryErrorType.UNEXPECTED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private DeliveryAttemptResult verifyIdentity() {
    try {
      transport.identify();
      return new DeliveryAttemptResult.Success(0L);
    } catch (TelegramTransportException ex) {
      logger.error("bot identity check failed reason={}", ex.reason());
      return new DeliveryAttemptResult.FatalFailure(
          DeliveryErrorType.from(ex.reason()), ex.getMessage());
    } catch (RuntimeException ex) {
      logger.error("unexpected failure during bot identity check", ex);
      return new DeliveryAttemptResult.FatalFailure(
          DeliveryErrorType.UNEXPECTED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private DeliveryAttemptResult classify(TelegramTransportException ex) {
    final DeliveryErrorType type = DeliveryErrorType.from(ex.reason());
    if (retryPolicy.isRetryable(ex.reason())) {
      return new DeliveryAttemptResult.RetryableFailure(type, ex.getMessage());
    }
    return new DeliveryAttemptResult.FatalFailure(type, ex.getMessage());
  }

  private DeliveryError errorOf(DeliveryAttemptResult result) {
    if (result instanceof DeliveryAttemptResult.RetryableFailure retryable) {
      return error(retryable.type(), retryable.reason());
    }
    if (result instanceof DeliveryAttemptResult.FatalFailure fatal) {
      return error(fatal.type(), fatal.reason());
    }
    throw new IllegalArgumentException("not a failure: " + result);
  }

  private NotificationRecord deadlineExceeded(NotificationRecord last, String message) {
    return last.failed(error(DeliveryErrorType.DEADLINE_EXCEEDED, message));
  }

  private void finish(NotificationRecord record) {
    if (!record.isTerminal()) {
      throw new IllegalStateException(
          "notification finished in non-terminal status " + record.status());
    }
    final Instant finishedAt = clock.instant();
    metrics.recordDeliveryResult(record.status().name().toLowerCase(Locale.ROOT));
    metrics.recordDeliveryDuration(record.createdAt(), finishedAt);
    if (record.status() == DeliveryStatus.SENT) {
      logger.info(
          "notification delivered fragments={} retryCount={}",
          record.sentFragmentCount(),
          record.retryCount());
      return;
    }
    logger.error(
        "notification delivery failed status={} sentFragments={}/{} retryCount={} type={} error={}",
        record.status(),
        record.sentFragmentCount(),
        record.fragments().size(),
        record.retryCount(),
        record.lastError() == null ? null : record.lastError().type(),
        record.lastError() == null ? null : record.lastError().message());
  }

  private DeliveryError error(DeliveryErrorType type, String message) {
    return new DeliveryError(type, truncateError(message));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = settings.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private static NotificationRecord observe(
      NotificationRecord record, Consumer<NotificationRecord> observer) {
    observer.accept(record);
    return record;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
