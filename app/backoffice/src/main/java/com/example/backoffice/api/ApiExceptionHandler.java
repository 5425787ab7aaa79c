/*
 * どこで: Backoffice API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: ドメインエラーと永続化競合を呼び出し側が区別できるようにするため
 */
package com.example.backoffice.api;

import com.example.backoffice.model.AlreadyDeletedException;
import com.example.backoffice.model.DomainRuleViolationException;
import com.example.backoffice.model.InvalidTransitionException;
import com.example.backoffice.service.AggregateNotFoundException;
import com.example.backoffice.service.DeadLetterStateException;
import com.example.backoffice.service.OperationCancelledException;
import com.example.backoffice.service.OutboxMessageNotFoundException;
import com.example.backoffice.service.PersistenceConflictException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.INVALID_TRANSITION, ex.getMessage());
  }

  @ExceptionHandler(AlreadyDeletedException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyDeleted(AlreadyDeletedException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ALREADY_DELETED, ex.getMessage());
  }

  @ExceptionHandler(DomainRuleViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleDomainRuleViolation(
      DomainRuleViolationException ex) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, ApiErrorCode.DOMAIN_RULE_VIOLATION, ex.getMessage());
  }

  @ExceptionHandler(PersistenceConflictException.class)
  public ResponseEntity<ApiErrorResponse> handlePersistenceConflict(
      PersistenceConflictException ex) {
    // 内部の SQL 文言は返さない
    return error(
        HttpStatus.CONFLICT,
        ApiErrorCode.PERSISTENCE_CONFLICT,
        "resource was modified concurrently; retry the request");
  }

  @ExceptionHandler({AggregateNotFoundException.class, OutboxMessageNotFoundException.class})
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(DeadLetterStateException.class)
  public ResponseEntity<ApiErrorResponse> handleDeadLetterState(DeadLetterStateException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.NOT_DEAD_LETTERED, ex.getMessage());
  }

  @ExceptionHandler(OperationCancelledException.class)
  public ResponseEntity<ApiErrorResponse> handleOperationCancelled(
      OperationCancelledException ex) {
    return error(HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.OPERATION_CANCELLED, ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先する
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
