/*
 * どこで: Backoffice ドメイン層
 * 何を: 業務ルール違反の基底例外
 * なぜ: API 層で 4xx に一括変換するため
 */
package com.example.backoffice.model;

public abstract class DomainException extends RuntimeException {

  protected DomainException(String message) {
    super(message);
  }
}
