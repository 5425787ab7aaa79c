/*
 * どこで: Backoffice 運用操作
 * 何を: dead-letter ではない行を再投入しようとしたことを表す
 */
package com.example.backoffice.service;

public class DeadLetterStateException extends RuntimeException {

  public DeadLetterStateException(String message) {
    super(message);
  }
}
