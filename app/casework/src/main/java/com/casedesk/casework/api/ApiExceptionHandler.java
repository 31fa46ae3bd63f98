/*
 * どこで: Casework API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一するため
 */
package com.casedesk.casework.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IdempotencyConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleIdempotencyConflict(
      IdempotencyConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.IDEMPOTENCY_KEY_CONFLICT, ex.getMessage()));
  }

  @ExceptionHandler(IdempotencyInProgressException.class)
  public ResponseEntity<ApiErrorResponse> handleIdempotencyInProgress(
      IdempotencyInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            new ApiErrorResponse(ApiErrorCode.IDEMPOTENCY_REQUEST_IN_PROGRESS, ex.getMessage()));
  }

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
    final Map<String, String> details = new LinkedHashMap<>();
    details.put("current_status", ex.getCurrentStatus());
    details.put("target_status", ex.getTargetStatus());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_TRANSITION, ex.getMessage(), details));
  }

  @ExceptionHandler(MissingAnnotationException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingAnnotation(MissingAnnotationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.MISSING_ANNOTATION, ex.getMessage()));
  }

  @ExceptionHandler(LockConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleLockConflict(LockConflictException ex) {
    // 誰がいつから編集中かを返し、クライアントが待つか連絡するかを判断できるようにする
    final Map<String, String> details = new LinkedHashMap<>();
    details.put("holder", ex.getHolderId());
    details.put("acquired_at", String.valueOf(ex.getAcquiredAt()));
    details.put("last_activity_at", String.valueOf(ex.getLastActivityAt()));
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.LOCK_CONFLICT, ex.getMessage(), details));
  }

  @ExceptionHandler(LockNotHeldException.class)
  public ResponseEntity<ApiErrorResponse> handleLockNotHeld(LockNotHeldException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse(ApiErrorCode.LOCK_NOT_HELD, ex.getMessage()));
  }

  @ExceptionHandler(CaseVersionConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleVersionConflict(CaseVersionConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.CONCURRENT_MODIFICATION, ex.getMessage()));
  }

  @ExceptionHandler(CaseNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleCaseNotFound(CaseNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.CASE_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(DependencyUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleDependencyUnavailable(
      DependencyUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.DEPENDENCY_UNAVAILABLE,
                ex.getMessage(),
                Map.of("dependency", ex.getDependency())));
  }

  @ExceptionHandler({NoActiveTransactionException.class, SequenceAllocationException.class})
  public ResponseEntity<ApiErrorResponse> handleInternalError(RuntimeException ex) {
    // 内部状態は応答に出さず、ログにだけ残す
    logger.error("internal write-safety failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
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
    // パス/ヘッダなどの検証エラーは最初の1件に絞って返す。
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
