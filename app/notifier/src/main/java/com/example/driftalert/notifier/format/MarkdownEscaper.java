/*
 * どこで: Notifier メッセージ整形
 * 何を: Telegram MarkdownV2 の予約文字をエスケープする
 * なぜ: 動的な文字列(リソース名/属性値/環境名)がマークアップとして解釈されないようにするため
 */
package com.example.driftalert.notifier.format;

public final class MarkdownEscaper {

  public static final String RESERVED_CHARACTERS = "_*[]()~`>#+-=|{}.!";
  public static final char ESCAPE_MARKER = '\\';

  private MarkdownEscaper() {}

  public static String escape(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    final StringBuilder escaped = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (RESERVED_CHARACTERS.indexOf(c) >= 0) {
        escaped.append(ESCAPE_MARKER);
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
