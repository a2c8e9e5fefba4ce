/*
 * どこで: Notifier メッセージ整形
 * 何を: 組み立て済みメッセージを上限長以下の番号付きメッセージ片へ分割する
 * なぜ: Telegram の 1 メッセージ上限を守りつつ、リソースブロックを途中で切らずに読める順序で届けるため
 */
package com.example.driftalert.notifier.format;

import com.example.driftalert.common.event.DriftEvent;
import com.example.driftalert.notifier.model.MessageFragment;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class MessageSplitter {

  public static final int DEFAULT_MAX_LENGTH = 4096;
  /** パートヘッダー用に確保しておく文字数。 */
  public static final int RESERVED_BUFFER = 100;

  static final String ELLIPSIS = "\\.\\.\\.";
  static final String SECTION_DELIMITER = "\n\n";

  public List<MessageFragment> split(String message, DriftEvent event) {
    return split(message, event, DEFAULT_MAX_LENGTH, true);
  }

  /**
   * 役割: message を maxLength 以下のメッセージ片に分割する。
   * 動作: 実効上限(maxLength - 100)に収まれば 1 片。超える場合はセパレーター行までをヘッダーとして先頭片に載せ、
   * 本文を空行区切りのセクション単位で貪欲に詰める。単独で実効上限を超える塊だけを行境界で切る。
   * 複数片になった場合のみ "Part i/n" ヘッダーを付ける。
   * 前提: maxLength は RESERVED_BUFFER より大きい。
   */
  public List<MessageFragment> split(
      String message, DriftEvent event, int maxLength, boolean splitOnResourceBoundary) {
    if (maxLength <= RESERVED_BUFFER) {
      throw new IllegalArgumentException(
          "maxLength must exceed reserved buffer " + RESERVED_BUFFER + ": " + maxLength);
    }
    final int effectiveLimit = maxLength - RESERVED_BUFFER;
    if (message.length() <= effectiveLimit) {
      return List.of(MessageFragment.unsent(1, 1, message));
    }
    final List<String> chunks =
        splitOnResourceBoundary
            ? splitOnSections(message, effectiveLimit)
            : splitOnLines(message, effectiveLimit);
    return toFragments(chunks, event, maxLength);
  }

  private List<String> splitOnSections(String message, int effectiveLimit) {
    final int separatorIndex = message.indexOf(DriftMessageComposer.SEPARATOR);
    final String header;
    final String body;
    if (separatorIndex >= 0) {
      final int headerEnd = separatorIndex + DriftMessageComposer.SEPARATOR.length();
      header = message.substring(0, headerEnd);
      body = message.substring(headerEnd);
    } else {
      header = "";
      body = message;
    }

    final List<String> chunks = new ArrayList<>();
    String current = header;
    for (String section : body.split(SECTION_DELIMITER)) {
      final String trimmed = trimNewlines(section);
      if (trimmed.isBlank()) {
        continue;
      }
      if (current.isEmpty()) {
        current = trimmed;
        continue;
      }
      final String candidate = current + SECTION_DELIMITER + trimmed;
      if (candidate.length() <= effectiveLimit) {
        current = candidate;
      } else {
        chunks.add(current);
        current = trimmed;
      }
    }
    if (!current.isEmpty()) {
      chunks.add(current);
    }

    // 単独で収まらないブロックだけを行境界で切る
    final List<String> bounded = new ArrayList<>();
    for (String chunk : chunks) {
      if (chunk.length() > effectiveLimit) {
        bounded.addAll(splitOnLines(chunk, effectiveLimit));
      } else {
        bounded.add(chunk);
      }
    }
    return bounded;
  }

  @VisibleForTesting
  List<String> splitOnLines(String text, int limit) {
    final List<String> parts = new ArrayList<>();
    String remaining = text;
    while (remaining.length() > limit) {
      int cut = remaining.lastIndexOf('\n', limit);
      if (cut <= 0) {
        // 改行が無い場合は上限位置で切る
        cut = safeCutIndex(remaining, limit);
      }
      final String part = trimNewlines(remaining.substring(0, cut));
      if (!part.isBlank()) {
        parts.add(part);
      }
      remaining = stripLeadingNewlines(remaining.substring(cut));
    }
    if (!remaining.isBlank()) {
      parts.add(remaining);
    }
    return parts;
  }

  private List<MessageFragment> toFragments(List<String> chunks, DriftEvent event, int maxLength) {
    final int totalParts = chunks.size();
    final List<MessageFragment> fragments = new ArrayList<>(totalParts);
    for (int i = 0; i < totalParts; i++) {
      final int partNumber = i + 1;
      String content = chunks.get(i);
      if (totalParts > 1) {
        content = partHeader(event, partNumber, totalParts) + content;
      }
      content = fitToLimit(content, maxLength);
      fragments.add(MessageFragment.unsent(partNumber, totalParts, content));
    }
    return List.copyOf(fragments);
  }

  static String partHeader(DriftEvent event, int partNumber, int totalParts) {
    final String title =
        event != null && !event.driftDetected() ? "✅ *Drift Check" : "🔔 *Drift Alert";
    return title + " \\(Part " + partNumber + "/" + totalParts + "\\)*" + SECTION_DELIMITER;
  }

  /**
   * 役割: content が maxLength を超える場合に末尾を切り詰めて省略記号を付ける。
   * 動作: 省略記号込みでも収まらない場合は MessageSizeException を送出し、上限超過の片を返さない。
   */
  @VisibleForTesting
  String fitToLimit(String content, int maxLength) {
    if (content.length() <= maxLength) {
      return content;
    }
    final int keep = maxLength - ELLIPSIS.length();
    if (keep <= 0) {
      throw new MessageSizeException(
          "fragment of " + content.length() + " chars cannot be truncated to " + maxLength);
    }
    final String truncated = content.substring(0, safeCutIndex(content, keep)) + ELLIPSIS;
    if (truncated.length() > maxLength) {
      throw new MessageSizeException(
          "fragment still exceeds " + maxLength + " chars after truncation");
    }
    return truncated;
  }

  /**
   * cut 位置がサロゲートペアの途中やエスケープ記号の直後に来ないよう前へずらす。
   * 先頭 1 文字しか残らない場合は、ペアやエスケープ列を丸ごと含めるよう後ろへずらす。
   */
  private static int safeCutIndex(String text, int cut) {
    int index = Math.min(cut, text.length());
    if (index > 0
        && index < text.length()
        && Character.isHighSurrogate(text.charAt(index - 1))) {
      index = index > 1 ? index - 1 : index + 1;
    }
    int markers = 0;
    while (index - markers - 1 >= 0
        && text.charAt(index - markers - 1) == MarkdownEscaper.ESCAPE_MARKER) {
      markers++;
    }
    if (markers % 2 == 1 && index < text.length()) {
      index = index > 1 ? index - 1 : index + 1;
    }
    return index;
  }

  private static String trimNewlines(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '\n') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '\n') {
      end--;
    }
    return value.substring(start, end);
  }

  private static String stripLeadingNewlines(String value) {
    int start = 0;
    while (start < value.length() && value.charAt(start) == '\n') {
      start++;
    }
    return value.substring(start);
  }
}
