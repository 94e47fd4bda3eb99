/*
 * どこで: Deal-BFF API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: authority 障害(502)・authority の拒否・入力不備(400)をクライアントが区別できるようにするため
 */
package com.dealdesk.deal_bff.api;

import com.dealdesk.deal_bff.service.ActionValidationException;
import com.dealdesk.deal_bff.service.AuthorityIntegrationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class BffApiExceptionHandler {

  @ExceptionHandler(AuthorityIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthorityIntegration(
      AuthorityIntegrationException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case UNAVAILABLE -> ApiErrorCode.AUTHORITY_UNAVAILABLE;
          case TIMEOUT -> ApiErrorCode.AUTHORITY_TIMEOUT;
          case INVALID_RESPONSE -> ApiErrorCode.AUTHORITY_INVALID_RESPONSE;
          case REJECTED -> ApiErrorCode.AUTHORITY_REJECTED;
        };
    // 利用不可系は一律 502。拒否は authority の 4xx をそのまま返す。
    final HttpStatus status =
        switch (ex.reason()) {
          case UNAVAILABLE, TIMEOUT, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
          case REJECTED -> resolveRejectedStatus(ex.statusCode());
        };
    final boolean exposeDetails = ex.reason() == AuthorityIntegrationException.Reason.REJECTED;
    return ResponseEntity.status(status)
        .body(
            new ApiErrorResponse(
                code, ex.getMessage(), exposeDetails ? ex.responseBody() : null));
  }

  @ExceptionHandler(ActionValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleActionValidation(ActionValidationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
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

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
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

  private HttpStatus resolveRejectedStatus(int statusCode) {
    final HttpStatus resolved = HttpStatus.resolve(statusCode);
    if (resolved == null || !resolved.is4xxClientError()) {
      return HttpStatus.BAD_REQUEST;
    }
    return resolved;
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
