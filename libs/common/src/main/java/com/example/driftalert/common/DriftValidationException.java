/*
 * どこで: Drift 共通例外
 * 何を: 入力レポートや設定値の検証失敗を表現する
 * なぜ: リトライ不能な入力不正を送信前に確定させ、違反内容をまとめて報告するため
 */
package com.example.driftalert.common;

import java.util.List;

public class DriftValidationException extends RuntimeException {

  private final String subject;
  private final List<String> violations;

  public DriftValidationException(String subject, List<String> violations) {
    super(subject + ": " + String.join("; ", violations));
    this.subject = subject;
    this.violations = List.copyOf(violations);
  }

  public String subject() {
    return subject;
  }

  public List<String> violations() {
    return violations;
  }
}
