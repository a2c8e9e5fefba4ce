/*
 * どこで: Drift 共通イベントモデル
 * 何を: リソース変更のアクション種別を定義する
 * なぜ: レポート入力の action 値を列挙型で固定し、未知値を入口で弾くため
 */
package com.example.driftalert.common.event;

public enum ChangeAction {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete"),
  REPLACE("replace"),
  NO_OP("no-op");

  private final String value;

  ChangeAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: レポート上の action 文字列を内部列挙型へ変換する。
   * 動作: 完全一致で判定し、未対応値は IllegalArgumentException を送出する。
   */
  public static ChangeAction fromValue(String action) {
    for (ChangeAction changeAction : values()) {
      if (changeAction.value.equals(action)) {
        return changeAction;
      }
    }
    throw new IllegalArgumentException("unsupported action: " + action);
  }
}
