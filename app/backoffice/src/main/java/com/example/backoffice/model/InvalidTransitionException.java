/*
 * どこで: Backoffice ドメイン層
 * 何を: 遷移表に存在しない (状態, 操作) の呼び出しを表す
 * なぜ: 呼び出し元に現在状態と試みた操作を返すため
 */
package com.example.backoffice.model;

public class InvalidTransitionException extends DomainException {

  private final String aggregateType;
  private final String currentState;
  private final String operation;

  public InvalidTransitionException(String aggregateType, String currentState, String operation) {
    super(aggregateType + " cannot " + operation + " from " + currentState);
    this.aggregateType = aggregateType;
    this.currentState = currentState;
    this.operation = operation;
  }

  public String aggregateType() {
    return aggregateType;
  }

  public String currentState() {
    return currentState;
  }

  public String operation() {
    return operation;
  }
}
