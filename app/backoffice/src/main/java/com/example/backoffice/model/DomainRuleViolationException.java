/*
 * どこで: Backoffice ドメイン層
 * 何を: 遷移自体は許可されるがガード条件を満たさない場合の例外
 * なぜ: 追跡番号の欠落や過去日付の予約などを遷移不可と区別するため
 */
package com.example.backoffice.model;

public class DomainRuleViolationException extends DomainException {

  public DomainRuleViolationException(String message) {
    super(message);
  }
}
