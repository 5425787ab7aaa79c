/*
 * どこで: Backoffice データアクセス
 * 何を: 論理削除済みの集約を検索対象に含めるかを明示する述語
 * なぜ: 暗黙のグローバルフィルタではなく呼び出し側が選んだ条件を SQL に埋め込むため
 */
package com.example.backoffice.repository;

public enum SoftDeleteFilter {
  EXCLUDE_DELETED,
  INCLUDE_DELETED;

  /** {@code alias} のテーブルに対する WHERE 句の断片を返す。 */
  public String predicate(String alias) {
    return switch (this) {
      case EXCLUDE_DELETED -> alias + ".deleted = FALSE";
      case INCLUDE_DELETED -> "TRUE";
    };
  }
}
