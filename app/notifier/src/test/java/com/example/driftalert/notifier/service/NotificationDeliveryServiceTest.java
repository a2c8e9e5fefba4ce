/*
 * どこで: Notifier 配信制御のユニットテスト
 * 何を: 抑止/再試行枯渇/致命的失敗/複数片送信/レコード全体の再試行上限/期限切れを検証する
 * なぜ: 送信回数と待機時間の組み合わせが仕様どおりであることを、実際に待たずに確認するため
 */
package com.example.driftalert.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.driftalert.common.event.ChangeAction;
import com.example.driftalert.common.event.DriftEvent;
import com.example.driftalert.common.event.ResourceChange;
import com.example.driftalert.notifier.config.NotificationSettings;
import com.example.driftalert.notifier.config.NotifierProperties;
import com.example.driftalert.notifier.format.DriftMessageComposer;
import com.example.driftalert.notifier.format.MessageSizeException;
import com.example.driftalert.notifier.format.MessageSplitter;
import com.example.driftalert.notifier.format.ResourceChangeRenderer;
import com.example.driftalert.notifier.model.DeliveryErrorType;
import com.example.driftalert.notifier.model.DeliveryStatus;
import com.example.driftalert.notifier.model.MessageFragment;
import com.example.driftalert.notifier.model.NotificationRecord;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-15T10:30:00Z");
  private static final Clock FIXED_CLOCK = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
  private static final String TOKEN = "123456789:ABCdefGhIJKlmNoPQRstuVWXyz";
  private static final String CHANNEL = "@drift_alerts";
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  @Mock private TelegramTransport transport;

  private final List<Duration> sleeps = new ArrayList<>();
  private final Sleeper recordingSleeper = sleeps::add;
  private final DriftMessageComposer composer =
      new DriftMessageComposer(new ResourceChangeRenderer());
  private final MessageSplitter splitter = new MessageSplitter();
  private SimpleMeterRegistry registry;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void suppressedNoDriftEndsSentWithoutTransportCalls() {
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(noDriftEvent(), "run42");

    assertThat(record.status()).isEqualTo(DeliveryStatus.SENT);
    assertThat(record.fragments()).isEmpty();
    assertThat(record.sentAt()).isEqualTo(FIXED_NOW);
    verifyNoInteractions(transport);
  }

  @Test
  void noDriftIsSentWhenEnabled() {
    when(transport.sendMessage(eq(CHANNEL), anyString(), eq(true))).thenReturn(11L);
    final NotificationDeliveryService service = newService(settings(3, true, 1000));

    final NotificationRecord record = service.deliver(noDriftEvent(), "run42");

    assertThat(record.status()).isEqualTo(DeliveryStatus.SENT);
    assertThat(record.fragments()).hasSize(1);
    assertThat(record.fragments().get(0).remoteMessageId()).isEqualTo(11L);
    assertThat(record.fragments().get(0).content()).contains("No Infrastructure Drift Detected");
  }

  @Test
  void notificationIdCombinesRunIdAndCreationTime() {
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(noDriftEvent(), "run42");

    assertThat(record.notificationId()).isEqualTo("drift_run42_20260115_103000");
    assertThat(record.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(record.channelId()).isEqualTo(CHANNEL);
  }

  @Test
  void blankRunIdFallsBackToGeneratedId() {
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(noDriftEvent(), null);

    assertThat(record.notificationId()).matches("drift_[0-9a-f]{8}_20260115_103000");
  }

  @Test
  void retryableFailureIsAttemptedMaxRetriesTimesThenFails() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(networkFailure());
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    verify(transport, times(3)).sendMessage(anyString(), anyString(), anyBoolean());
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.NETWORK);
    assertThat(record.retryCount()).isEqualTo(2);
    assertThat(record.sentAt()).isNull();
    assertThat(
            registry
                .get("drift.notification.attempt.total")
                .tag("outcome", "retryable_failure")
                .counter()
                .count())
        .isEqualTo(3.0d);
    assertThat(
            registry.get("drift.notification.delivery.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void fatalFailureStopsAfterSingleAttemptWithoutWaiting() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(
            new TelegramTransportException(
                TelegramTransportException.Reason.INVALID_CREDENTIAL, "unauthorized"));
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    verify(transport, times(1)).sendMessage(anyString(), anyString(), anyBoolean());
    assertThat(sleeps).isEmpty();
    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.INVALID_CREDENTIAL);
    assertThat(record.retryCount()).isZero();
  }

  @Test
  void transientFailureThenSuccessEndsSent() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(new TelegramTransportException(TelegramTransportException.Reason.TIMEOUT, "slow"))
        .thenReturn(10L);
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    assertThat(record.status()).isEqualTo(DeliveryStatus.SENT);
    assertThat(record.retryCount()).isEqualTo(1);
    assertThat(record.lastError()).isNull();
    assertThat(record.fragments().get(0).remoteMessageId()).isEqualTo(10L);
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
  }

  @Test
  void multipleFragmentsAreSentInOrderWithPacing() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenReturn(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L);
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(40), "run42");

    final List<MessageFragment> fragments = record.fragments();
    assertThat(fragments.size()).isGreaterThan(1);
    assertThat(record.status()).isEqualTo(DeliveryStatus.SENT);
    assertThat(record.sentFragmentCount()).isEqualTo(fragments.size());
    final InOrder order = inOrder(transport);
    for (MessageFragment fragment : fragments) {
      assertThat(fragment.remoteMessageId()).isEqualTo((long) fragment.partNumber());
      order.verify(transport).sendMessage(CHANNEL, fragment.content(), true);
    }
    assertThat(sleeps).hasSize(fragments.size() - 1).containsOnly(Duration.ofMillis(100));
  }

  @Test
  void retryCountIsCappedAcrossFragments() {
    final TelegramTransportException failure = networkFailure();
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(failure, failure)
        .thenReturn(1L)
        .thenThrow(failure);
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(40), "run42");

    verify(transport, times(5)).sendMessage(anyString(), anyString(), anyBoolean());
    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.retryCount()).isEqualTo(3);
    assertThat(record.sentFragmentCount()).isEqualTo(1);
    assertThat(sleeps)
        .containsExactly(
            Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofMillis(100), Duration.ofSeconds(2));
  }

  @Test
  void identityFailureFailsBeforeAnySend() {
    when(transport.identify())
        .thenThrow(
            new TelegramTransportException(
                TelegramTransportException.Reason.INVALID_CREDENTIAL, "unauthorized"));
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.INVALID_CREDENTIAL);
    verify(transport, never()).sendMessage(anyString(), anyString(), anyBoolean());
  }

  @Test
  void sizeViolationFailsBeforeAnyNetworkCall() {
    final MessageSplitter failingSplitter = mock(MessageSplitter.class);
    when(failingSplitter.split(anyString(), any(DriftEvent.class), eq(4096), eq(true)))
        .thenThrow(new MessageSizeException("fragment too large"));
    final NotificationDeliveryService service =
        newService(settings(3, false, 1000), failingSplitter, recordingSleeper);

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.SIZE_VIOLATION);
    assertThat(record.lastError().message()).isEqualTo("fragment too large");
    verifyNoInteractions(transport);
  }

  @Test
  void unexpectedTransportExceptionIsFatal() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(new IllegalStateException("boom"));
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    verify(transport, times(1)).sendMessage(anyString(), anyString(), anyBoolean());
    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.UNEXPECTED);
    assertThat(record.lastError().message()).isEqualTo("IllegalStateException: boom");
  }

  @Test
  void errorMessageIsTruncatedToConfiguredLength() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(
            new TelegramTransportException(
                TelegramTransportException.Reason.BAD_REQUEST, "x".repeat(50)));
    final NotificationDeliveryService service = newService(settings(3, false, 10));

    final NotificationRecord record = service.deliver(driftEvent(2), "run42");

    assertThat(record.lastError().message()).hasSize(10);
  }

  @Test
  void interruptedWaitFailsWithDeadlineExceeded() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(networkFailure());
    final Sleeper interrupted =
        duration -> {
          throw new InterruptedException("stop");
        };
    final NotificationDeliveryService service =
        newService(settings(3, false, 1000), splitter, interrupted);

    try {
      final NotificationRecord record = service.deliver(driftEvent(2), "run42");

      assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
      assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.DEADLINE_EXCEEDED);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void deliverWithinReturnsResultWhenFinishedInTime() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean())).thenReturn(5L);
    final NotificationDeliveryService service = newService(settings(3, false, 1000));

    final NotificationRecord record =
        service.deliverWithin(driftEvent(2), "run42", Duration.ofSeconds(5));

    assertThat(record.status()).isEqualTo(DeliveryStatus.SENT);
  }

  @Test
  void deliverWithinFailsWithDeadlineExceededWhenRetriesOutlastDeadline() {
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenThrow(networkFailure());
    final NotificationDeliveryService service =
        newService(settings(3, false, 1000), splitter, Sleeper.threadSleep());

    final NotificationRecord record =
        service.deliverWithin(driftEvent(2), "run42", Duration.ofMillis(300));

    assertThat(record.status()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(record.lastError().type()).isEqualTo(DeliveryErrorType.DEADLINE_EXCEEDED);
    assertThat(record.notificationId()).isEqualTo("drift_run42_20260115_103000");
    assertThat(record.fragments()).hasSize(1);
  }

  @Test
  void concurrentDeliveriesDoNotWaitForEachOther() throws Exception {
    final CountDownLatch slowSendStarted = new CountDownLatch(1);
    final CountDownLatch releaseSlowSend = new CountDownLatch(1);
    when(transport.sendMessage(anyString(), anyString(), anyBoolean()))
        .thenAnswer(
            invocation -> {
              final String text = invocation.getArgument(1);
              if (text.contains("staging")) {
                slowSendStarted.countDown();
                releaseSlowSend.await(5, TimeUnit.SECONDS);
                return 1L;
              }
              return 2L;
            });
    final NotificationDeliveryService service = newService(settings(3, false, 1000));
    final ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      final Future<NotificationRecord> slow =
          caller.submit(
              () ->
                  service.deliverWithin(
                      driftEvent(1).withEnvironment("staging"), "slow", Duration.ofSeconds(10)));
      assertThat(slowSendStarted.await(5, TimeUnit.SECONDS)).isTrue();

      final NotificationRecord fast =
          service.deliverWithin(driftEvent(1), "fast", Duration.ofSeconds(2));

      assertThat(fast.status()).isEqualTo(DeliveryStatus.SENT);
      assertThat(fast.fragments().get(0).remoteMessageId()).isEqualTo(2L);
      releaseSlowSend.countDown();
      final NotificationRecord slowRecord = slow.get(5, TimeUnit.SECONDS);
      assertThat(slowRecord.status()).isEqualTo(DeliveryStatus.SENT);
      assertThat(slowRecord.fragments().get(0).remoteMessageId()).isEqualTo(1L);
    } finally {
      releaseSlowSend.countDown();
      caller.shutdownNow();
    }
  }

  private NotificationDeliveryService newService(NotificationSettings settings) {
    return newService(settings, splitter, recordingSleeper);
  }

  private NotificationDeliveryService newService(
      NotificationSettings settings, MessageSplitter messageSplitter, Sleeper sleeper) {
    return new NotificationDeliveryService(
        transport,
        composer,
        messageSplitter,
        new RetryBackoffPolicy(
            settings.maxRetries(),
            settings.initialRetryDelay(),
            settings.retryMultiplier(),
            settings.maxRetryDelay()),
        settings,
        new NotificationMetrics(registry),
        sleeper,
        FIXED_CLOCK,
        executor);
  }

  private static NotificationSettings settings(
      int maxRetries, boolean notifyOnNoDrift, int errorMessageMaxLength) {
    return NotificationSettings.validate(
            new NotifierProperties(
                TOKEN,
                CHANNEL,
                maxRetries,
                null,
                null,
                null,
                null,
                null,
                null,
                notifyOnNoDrift,
                null,
                null,
                null,
                errorMessageMaxLength))
        .orElseThrow();
  }

  private static TelegramTransportException networkFailure() {
    return new TelegramTransportException(TelegramTransportException.Reason.NETWORK, "reset");
  }

  private static DriftEvent noDriftEvent() {
    return new DriftEvent(FIXED_NOW, "production", "main", "12345", "", false, List.of());
  }

  private static DriftEvent driftEvent(int changeCount) {
    final List<ResourceChange> changes = new ArrayList<>();
    for (int i = 0; i < changeCount; i++) {
      changes.add(
          new ResourceChange(
              "aws_instance",
              String.format("web-%03d-%s", i, "x".repeat(60)),
              ChangeAction.UPDATE,
              Map.of("instance_type", NODES.textNode("t2.micro")),
              Map.of("instance_type", NODES.textNode("t3.small"))));
    }
    return new DriftEvent(FIXED_NOW, "production", "main", "12345", "", true, changes);
  }
}
