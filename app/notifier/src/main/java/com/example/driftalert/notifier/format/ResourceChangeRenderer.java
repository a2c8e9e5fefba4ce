/*
 * どこで: Notifier メッセージ整形
 * 何を: 1 リソース変更を「記号 + 太字の表示名 + 差分の箇条書き」のブロックへ変換する
 * なぜ: 変更ブロック単位で分割できるよう、1 ブロック = 空行を含まない連続行に揃えるため
 */
package com.example.driftalert.notifier.format;

import com.example.driftalert.common.event.ChangeAction;
import com.example.driftalert.common.event.ResourceChange;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ResourceChangeRenderer {

  static final String DEFAULT_SYMBOL = "•";
  static final String BULLET_PREFIX = "  • ";

  private static final Map<ChangeAction, String> SYMBOLS = new EnumMap<>(ChangeAction.class);

  static {
    SYMBOLS.put(ChangeAction.CREATE, "➕");
    SYMBOLS.put(ChangeAction.UPDATE, "📝");
    SYMBOLS.put(ChangeAction.DELETE, "❌");
    SYMBOLS.put(ChangeAction.REPLACE, "🔄");
    SYMBOLS.put(ChangeAction.NO_OP, "✓");
  }

  public String render(ResourceChange change) {
    final StringBuilder block = new StringBuilder();
    block
        .append(symbolFor(change.action()))
        .append(" *")
        .append(MarkdownEscaper.escape(change.displayName()))
        .append('*');
    for (String summary : change.changeSummary()) {
      block.append('\n').append(BULLET_PREFIX).append(MarkdownEscaper.escape(summary));
    }
    return block.toString();
  }

  static String symbolFor(ChangeAction action) {
    return SYMBOLS.getOrDefault(action, DEFAULT_SYMBOL);
  }
}
