/*
 * どこで: Deal-BFF 下流 DTO
 * 何を: authority の act (イベント追記) が 2xx で返した本文を受け取ったままの形で保持する
 * なぜ: 2xx の時点で追記は確定しているため、本文の形に関わらず確定結果として台帳へ残すため
 */
package com.dealdesk.deal_bff.service.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record AuthorityAppendResult(JsonNode body) {

  public AuthorityAppendResult {
    body = body == null ? null : body.deepCopy();
  }

  /** Id of the appended event, or null when the authority response does not carry one. */
  public String eventId() {
    final JsonNode id = body == null ? null : body.get("id");
    if (id == null || !id.isValueNode() || id.isNull() || id.asText().isBlank()) {
      return null;
    }
    return id.asText();
  }

  @Override
  public JsonNode body() {
    return body == null ? null : body.deepCopy();
  }
}
