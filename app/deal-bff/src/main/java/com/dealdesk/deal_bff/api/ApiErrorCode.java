/*
 * どこで: Deal-BFF API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも「authority 障害」と「authority の拒否」を区別できるようにするため
 */
package com.dealdesk.deal_bff.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  AUTHORITY_UNAVAILABLE,
  AUTHORITY_TIMEOUT,
  AUTHORITY_INVALID_RESPONSE,
  AUTHORITY_REJECTED
}
