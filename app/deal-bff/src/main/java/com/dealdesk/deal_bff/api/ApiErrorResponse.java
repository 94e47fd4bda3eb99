/*
 * どこで: Deal-BFF API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因と再試行可否を識別しやすくするため
 */
package com.dealdesk.deal_bff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(ApiErrorCode code, String message, JsonNode details) {

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null);
  }
}
