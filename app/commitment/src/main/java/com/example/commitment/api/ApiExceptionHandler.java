/*
 * どこで: Commitment API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: {code, message, details} のエラー応答を全エンドポイントで統一するため
 */
package com.example.commitment.api;

import com.example.commitment.service.client.CollaboratorIntegrationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(CommitmentValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(CommitmentValidationException ex) {
    final HttpStatus status =
        switch (ex.code()) {
          case SUBSCRIPTION_REQUIRED -> HttpStatus.FORBIDDEN;
          case DEVICE_NOT_FOUND, COMMITMENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
          case ACTIVE_COMMITMENT_EXISTS, COMMITMENT_STATE_CONFLICT -> HttpStatus.CONFLICT;
          default -> HttpStatus.BAD_REQUEST;
        };
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage(), ex.details()));
  }

  @ExceptionHandler(CommitmentNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(CommitmentNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.COMMITMENT_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(CommitmentStateConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleStateConflict(
      CommitmentStateConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.COMMITMENT_STATE_CONFLICT, ex.getMessage()));
  }

  @ExceptionHandler(CommitmentActivationException.class)
  public ResponseEntity<ApiErrorResponse> handleActivation(CommitmentActivationException ex) {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("retryable", ex.retryable());
    details.put("reenroll_required", ex.reenrollRequired());
    details.put("provider_error", ex.kind().name());
    if (ex.reenrollRequired()) {
      return ResponseEntity.status(HttpStatus.BAD_REQUEST)
          .body(new ApiErrorResponse(ApiErrorCode.DEVICE_NOT_ENROLLED, ex.getMessage(), details));
    }
    final HttpStatus status =
        ex.retryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
    final ApiErrorCode code =
        ex.retryable() ? ApiErrorCode.PROVIDER_UNAVAILABLE : ApiErrorCode.PROVIDER_ERROR;
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage(), details));
  }

  @ExceptionHandler(CollaboratorIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleCollaborator(CollaboratorIntegrationException ex) {
    logger.warn("collaborator call failed reason={} message={}", ex.reason(), ex.getMessage());
    if (ex.reason() == CollaboratorIntegrationException.Reason.TIMEOUT) {
      return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
          .body(new ApiErrorResponse(ApiErrorCode.UPSTREAM_TIMEOUT, "upstream service timeout"));
    }
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse(ApiErrorCode.UPSTREAM_ERROR, "upstream service failed"));
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
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
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
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.error("commitment store access failed", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.STORE_UNAVAILABLE, "commitment store is temporarily unavailable"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
