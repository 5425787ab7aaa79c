/*
 * どこで: Backoffice API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.backoffice.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  INVALID_TRANSITION,
  ALREADY_DELETED,
  PERSISTENCE_CONFLICT,
  NOT_DEAD_LETTERED,
  DOMAIN_RULE_VIOLATION,
  OPERATION_CANCELLED
}
