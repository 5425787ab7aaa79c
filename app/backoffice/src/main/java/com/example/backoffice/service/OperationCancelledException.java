/*
 * どこで: Backoffice サービス層
 * 何を: コミット前に取消が観測されたことを表す
 */
package com.example.backoffice.service;

public class OperationCancelledException extends RuntimeException {

  public OperationCancelledException(String message) {
    super(message);
  }
}
