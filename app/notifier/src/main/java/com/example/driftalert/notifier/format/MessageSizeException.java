/*
 * どこで: Notifier メッセージ整形
 * 何を: 切り詰め後もメッセージ片が上限を超えることを表す
 * なぜ: 上限超過のメッセージを黙って送らず、整形バグとして送信前に止めるため
 */
package com.example.driftalert.notifier.format;

public class MessageSizeException extends RuntimeException {

  public MessageSizeException(String message) {
    super(message);
  }
}
