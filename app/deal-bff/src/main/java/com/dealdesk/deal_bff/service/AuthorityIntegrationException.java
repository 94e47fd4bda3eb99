/*
 * どこで: Deal-BFF サービス層
 * 何を: authority 下流呼び出し失敗を「利用不可」と「拒否」に分類して表現する
 * なぜ: 再試行してよい失敗と、自動再試行してはならない拒否を呼び出し側で取り違えないため
 */
package com.dealdesk.deal_bff.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

public class AuthorityIntegrationException extends RuntimeException {

  public enum Reason {
    UNAVAILABLE,
    TIMEOUT,
    INVALID_RESPONSE,
    REJECTED
  }

  private static final int NO_STATUS = 0;
  private static final String UNKNOWN_ACTION_MARKER = "unknown action";

  private final Reason reason;
  private final int statusCode;
  private final transient JsonNode responseBody;

  public AuthorityIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.statusCode = NO_STATUS;
    this.responseBody = null;
  }

  public AuthorityIntegrationException(
      Reason reason, String message, int statusCode, JsonNode responseBody, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.statusCode = statusCode;
    this.responseBody = responseBody == null ? null : responseBody.deepCopy();
  }

  public Reason reason() {
    return reason;
  }

  /** HTTP status returned by the authority, or 0 when no response was received. */
  public int statusCode() {
    return statusCode;
  }

  public JsonNode responseBody() {
    return responseBody == null ? null : responseBody.deepCopy();
  }

  /**
   * UNAVAILABLE / TIMEOUT / INVALID_RESPONSE are safe to retry; REJECTED is not. INVALID_RESPONSE
   * only comes from read-only calls, since a 2xx act is always treated as committed.
   */
  public boolean isRetryable() {
    return reason != Reason.REJECTED;
  }

  public boolean isConflict() {
    return reason == Reason.REJECTED && statusCode == 409;
  }

  public boolean isUnknownAction() {
    if (reason != Reason.REJECTED || statusCode != 400 || responseBody == null) {
      return false;
    }
    final JsonNode message = responseBody.get("message");
    return message != null
        && message.isTextual()
        && message.asText().toLowerCase(Locale.ROOT).contains(UNKNOWN_ACTION_MARKER);
  }
}
