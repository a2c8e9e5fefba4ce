/*
 * どこで: Notifier メッセージ整形
 * 何を: DriftEvent 全体(ヘッダー/メタデータ/変更ブロック/リンク)を 1 本の MarkdownV2 文字列に組み立てる
 * なぜ: 同一入力から常に同一バイト列を得て、分割とテストフィクスチャを安定させるため
 */
package com.example.driftalert.notifier.format;

import com.example.driftalert.common.event.DriftEvent;
import com.example.driftalert.common.event.ResourceChange;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DriftMessageComposer {

  public static final String SEPARATOR = "━━━━━━━━━━━━━━━━";

  static final String DRIFT_HEADER = "🚨 *Infrastructure Drift Detected*";
  static final String NO_DRIFT_HEADER = "✅ *No Infrastructure Drift Detected*";
  static final String NO_DRIFT_BODY =
      "All infrastructure resources match their expected state\\.";

  // 日付区切りの '-' は予約文字のため書式側で事前にエスケープしておく
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy'\\-'MM'\\-'dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private final ResourceChangeRenderer renderer;

  public String compose(DriftEvent event, boolean includeWorkflowLink) {
    return event.driftDetected()
        ? composeDrift(event, includeWorkflowLink)
        : composeNoDrift(event, includeWorkflowLink);
  }

  public String composeDrift(DriftEvent event, boolean includeWorkflowLink) {
    final List<String> lines = new ArrayList<>();
    lines.add(DRIFT_HEADER);
    lines.add("");
    addMetadata(lines, event);
    lines.add("*Resources Affected:* " + event.totalChanges());
    lines.add("");

    final Map<String, Integer> counts = event.changesByAction();
    if (!counts.isEmpty()) {
      final String summary =
          counts.entrySet().stream()
              .map(entry -> entry.getKey() + ": " + entry.getValue())
              .collect(Collectors.joining(", "));
      lines.add("*Changes:* " + MarkdownEscaper.escape(summary));
      lines.add("");
    }

    lines.add(SEPARATOR);
    lines.add("");

    for (ResourceChange change : event.changes()) {
      lines.add(renderer.render(change));
      lines.add("");
    }

    if (includeWorkflowLink && event.hasRunUrl()) {
      // URL はリンク記法の中にそのまま置く
      lines.add("[View Full Report](" + event.runUrl() + ")");
    }
    return String.join("\n", lines);
  }

  public String composeNoDrift(DriftEvent event, boolean includeWorkflowLink) {
    final List<String> lines = new ArrayList<>();
    lines.add(NO_DRIFT_HEADER);
    lines.add("");
    addMetadata(lines, event);
    lines.add("");
    lines.add(NO_DRIFT_BODY);
    if (includeWorkflowLink && event.hasRunUrl()) {
      lines.add("");
      lines.add("[View Details](" + event.runUrl() + ")");
    }
    return String.join("\n", lines);
  }

  private void addMetadata(List<String> lines, DriftEvent event) {
    lines.add("*Environment:* " + MarkdownEscaper.escape(event.environment()));
    lines.add("*Branch:* " + MarkdownEscaper.escape(event.branch()));
    lines.add("*Time:* " + TIMESTAMP_FORMAT.format(event.timestamp()));
  }
}
