/*
 * どこで: Drift 共通イベントモデル
 * 何を: 1 回の drift 検知結果(メタデータ + リソース変更列)を保持する
 * なぜ: 整形と配信の双方が同じ入力スナップショットを参照するため
 */
package com.example.driftalert.common.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public record DriftEvent(
    Instant timestamp,
    String environment,
    String branch,
    String runId,
    String runUrl,
    boolean driftDetected,
    List<ResourceChange> changes) {

  public DriftEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    environment = environment == null ? "unknown" : environment;
    branch = branch == null ? "unknown" : branch;
    runId = runId == null ? "unknown" : runId;
    runUrl = runUrl == null ? "" : runUrl;
    changes = changes == null ? List.of() : List.copyOf(changes);
  }

  public int totalChanges() {
    return changes.size();
  }

  /** action 値の辞書順で並んだ件数集計。 */
  public Map<String, Integer> changesByAction() {
    final Map<String, Integer> counts = new TreeMap<>();
    for (ResourceChange change : changes) {
      counts.merge(change.action().value(), 1, Integer::sum);
    }
    return counts;
  }

  public boolean hasRunUrl() {
    return !runUrl.isBlank();
  }

  public DriftEvent withEnvironment(String overrideEnvironment) {
    return new DriftEvent(
        timestamp, overrideEnvironment, branch, runId, runUrl, driftDetected, changes);
  }
}
