/*
 * どこで: Deal-BFF 下流 DTO
 * 何を: authority が採番・ハッシュ連結したイベント 1 件を表す
 * なぜ: act の応答と監査タイムラインの双方で同じ形を扱うため
 */
package com.dealdesk.deal_bff.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record AuthorityEvent(
    String id,
    String dealId,
    String type,
    String actorId,
    JsonNode payload,
    Instant createdAt,
    Long sequenceNumber,
    String eventHash,
    String previousEventHash) {}
