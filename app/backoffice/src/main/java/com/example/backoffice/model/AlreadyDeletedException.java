/*
 * どこで: Backoffice ドメイン層
 * 何を: 論理削除済み集約への操作を拒否する
 */
package com.example.backoffice.model;

public class AlreadyDeletedException extends DomainException {

  private final String operation;

  public AlreadyDeletedException(String aggregateType, String operation) {
    super(aggregateType + " is already deleted; " + operation + " rejected");
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
