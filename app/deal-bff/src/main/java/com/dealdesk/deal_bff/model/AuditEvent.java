/*
 * どこで: Deal-BFF モデル
 * 何を: 統合監査タイムライン上の 1 イベント (出所タグ付き) を表す
 * なぜ: ローカルと authority の 2 本のチェーンを同じ形で並べ、個別に検証するため
 */
package com.dealdesk.deal_bff.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record AuditEvent(
    AuditSource source,
    String id,
    Long sequenceNumber,
    String hash,
    String previousHash,
    String eventType,
    JsonNode payload,
    String actorId,
    Instant occurredAt) {

  public AuditEvent {
    payload = payload == null ? null : payload.deepCopy();
  }

  @Override
  public JsonNode payload() {
    return payload == null ? null : payload.deepCopy();
  }
}
