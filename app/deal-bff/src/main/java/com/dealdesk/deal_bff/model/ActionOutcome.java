/*
 * どこで: Deal-BFF モデル
 * 何を: アクション実行の終端結果 (HTTP ステータス・応答本文・追記イベント ID) を表す
 * なぜ: 初回応答と台帳からの再送応答を同じ形で返すため
 */
package com.dealdesk.deal_bff.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ActionOutcome(int statusCode, JsonNode body, String appendedEventId) {

  public ActionOutcome {
    body = body == null ? null : body.deepCopy();
  }

  @Override
  public JsonNode body() {
    return body == null ? null : body.deepCopy();
  }
}
