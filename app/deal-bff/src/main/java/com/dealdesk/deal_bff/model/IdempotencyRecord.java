/*
 * どこで: Deal-BFF モデル
 * 何を: action_idempotency の 1 行を表す
 * なぜ: 完了/BLOCKED となったアクション結果を TTL 内で同一応答として返すため
 */
package com.dealdesk.deal_bff.model;

import java.time.Instant;

public record IdempotencyRecord(
    String idempotencyKey,
    String dealId,
    String actionType,
    String actorId,
    String payloadHash,
    int statusCode,
    String responseBodyJson,
    String appendedEventId,
    Instant createdAt,
    Instant expiresAt) {}
