/*
 * どこで: Drift 共通イベントモデル
 * 何を: 1 リソース分の変更内容(before/after 属性)を保持する
 * なぜ: 表示名と属性差分を導出する責務をモデル側に寄せるため
 */
package com.example.driftalert.common.event;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

public record ResourceChange(
    String kind,
    String name,
    ChangeAction action,
    Map<String, JsonNode> before,
    Map<String, JsonNode> after) {

  static final String NOT_SET = "[not set]";

  public ResourceChange {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(action, "action");
    before = before == null ? null : Map.copyOf(before);
    after = after == null ? null : Map.copyOf(after);
  }

  public String displayName() {
    return kind + "." + name;
  }

  /**
   * 役割: before/after で値が異なる属性を "key: before → after" 形式で返す。
   * 動作: キーは昇順。片側が欠落/空、または差分が無い場合は "Action: <action>" の 1 行にフォールバックする。
   */
  public List<String> changeSummary() {
    if (before == null || before.isEmpty() || after == null || after.isEmpty()) {
      return List.of(fallbackSummary());
    }
    final TreeSet<String> keys = new TreeSet<>(before.keySet());
    keys.addAll(after.keySet());
    final List<String> changes = new ArrayList<>();
    for (String key : keys) {
      final JsonNode beforeValue = before.get(key);
      final JsonNode afterValue = after.get(key);
      if (Objects.equals(beforeValue, afterValue)) {
        continue;
      }
      changes.add(key + ": " + render(beforeValue) + " → " + render(afterValue));
    }
    return changes.isEmpty() ? List.of(fallbackSummary()) : List.copyOf(changes);
  }

  private String fallbackSummary() {
    return "Action: " + action.value();
  }

  private static String render(JsonNode value) {
    if (value == null) {
      return NOT_SET;
    }
    // 文字列はそのまま、それ以外は JSON 表記で出す
    return value.isTextual() ? value.asText() : value.toString();
  }
}
