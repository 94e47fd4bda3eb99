/*
 * どこで: Deal-BFF 下流 DTO
 * 何を: authority の explain 応答を受け取ったままの形で保持する
 * なぜ: reasons/nextSteps など authority 側で増える項目をクライアントへ欠落なく返すため
 */
package com.dealdesk.deal_bff.service.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record AuthorityExplanation(JsonNode body) {

  public static final String STATUS_ALLOWED = "ALLOWED";
  public static final String STATUS_BLOCKED = "BLOCKED";

  public AuthorityExplanation {
    body = body == null ? null : body.deepCopy();
  }

  public String status() {
    final JsonNode status = body == null ? null : body.get("status");
    return status == null ? null : status.asText();
  }

  public boolean isBlocked() {
    return STATUS_BLOCKED.equals(status());
  }

  @Override
  public JsonNode body() {
    return body == null ? null : body.deepCopy();
  }
}
