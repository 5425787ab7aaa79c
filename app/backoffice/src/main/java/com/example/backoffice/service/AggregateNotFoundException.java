/*
 * どこで: Backoffice サービス層
 * 何を: 論理削除フィルタ適用後に集約が見つからないことを表す
 */
package com.example.backoffice.service;

import java.util.UUID;

public class AggregateNotFoundException extends RuntimeException {

  public AggregateNotFoundException(String aggregateType, UUID aggregateId) {
    super(aggregateType + " not found id=" + aggregateId);
  }
}
