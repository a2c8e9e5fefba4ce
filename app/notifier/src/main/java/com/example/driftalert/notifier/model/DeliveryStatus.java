/*
 * どこで: Notifier ドメインモデル
 * 何を: 通知配信の状態を表す列挙
 * なぜ: 配信状態機械の遷移先を固定するため
 */
package com.example.driftalert.notifier.model;

public enum DeliveryStatus {
  PENDING,
  SENDING,
  RETRYING,
  SENT,
  FAILED
}
