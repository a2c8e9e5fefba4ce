/*
 * どこで: Notifier ドメインモデル
 * 何を: 1 通知の配信スナップショット(片/状態/再試行回数/時刻/最終エラー)
 * なぜ: 配信状態機械の各遷移を不変値として記録し、途中経過を観測可能にするため
 */
package com.example.driftalert.notifier.model;

import com.example.driftalert.common.event.DriftEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record NotificationRecord(
    String notificationId,
    DriftEvent event,
    String channelId,
    List<MessageFragment> fragments,
    DeliveryStatus status,
    int retryCount,
    Instant createdAt,
    Instant sentAt,
    DeliveryError lastError) {

  public NotificationRecord {
    Objects.requireNonNull(notificationId, "notificationId");
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(status, "status");
    fragments = fragments == null ? List.of() : List.copyOf(fragments);
  }

  public static NotificationRecord pending(
      String notificationId, DriftEvent event, String channelId, Instant createdAt) {
    return new NotificationRecord(
        notificationId,
        event,
        channelId,
        List.of(),
        DeliveryStatus.PENDING,
        0,
        createdAt,
        null,
        null);
  }

  public NotificationRecord withFragments(List<MessageFragment> newFragments) {
    return new NotificationRecord(
        notificationId,
        event,
        channelId,
        newFragments,
        status,
        retryCount,
        createdAt,
        sentAt,
        lastError);
  }

  public NotificationRecord withFragmentSent(int index, long remoteMessageId) {
    final List<MessageFragment> updated = new ArrayList<>(fragments);
    updated.set(index, fragments.get(index).withRemoteMessageId(remoteMessageId));
    return withFragments(updated);
  }

  public NotificationRecord sending() {
    return withStatus(DeliveryStatus.SENDING);
  }

  /** 再試行待ちへ遷移し、retryCount を 1 増やす。 */
  public NotificationRecord retrying(DeliveryError cause) {
    return new NotificationRecord(
        notificationId,
        event,
        channelId,
        fragments,
        DeliveryStatus.RETRYING,
        retryCount + 1,
        createdAt,
        sentAt,
        cause);
  }

  public NotificationRecord sent(Instant completedAt) {
    return new NotificationRecord(
        notificationId,
        event,
        channelId,
        fragments,
        DeliveryStatus.SENT,
        retryCount,
        createdAt,
        completedAt,
        null);
  }

  public NotificationRecord failed(DeliveryError error) {
    return new NotificationRecord(
        notificationId,
        event,
        channelId,
        fragments,
        DeliveryStatus.FAILED,
        retryCount,
        createdAt,
        null,
        error);
  }

  public boolean isTerminal() {
    return status == DeliveryStatus.SENT || status == DeliveryStatus.FAILED;
  }

  public int sentFragmentCount() {
    return (int) fragments.stream().filter(MessageFragment::isSent).count();
  }

  public int totalMessageLength() {
    return fragments.stream().mapToInt(fragment -> fragment.content().length()).sum();
  }

  private NotificationRecord withStatus(DeliveryStatus newStatus) {
    return new NotificationRecord(
        notificationId,
        event,
        channelId,
        fragments,
        newStatus,
        retryCount,
        createdAt,
        sentAt,
        lastError);
  }
}
