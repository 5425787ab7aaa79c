/*
 * どこで: Backoffice サービス層
 * 何を: バージョン不一致/一意制約違反/ロック競合で保存できなかったことを表す
 * なぜ: 呼び出し側に「読み込みからやり直す」必要があることを伝えるため
 */
package com.example.backoffice.service;

public class PersistenceConflictException extends RuntimeException {

  public PersistenceConflictException(String message) {
    super(message);
  }

  public PersistenceConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
