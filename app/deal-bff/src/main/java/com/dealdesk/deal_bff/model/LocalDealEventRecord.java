/*
 * どこで: Deal-BFF モデル
 * 何を: BFF が保持する deal 監査イベント (ハッシュチェーンの 1 要素) を表す
 * なぜ: authority 側とは独立した改ざん検知可能な監査ログを持つため
 */
package com.dealdesk.deal_bff.model;

import java.time.Instant;

public record LocalDealEventRecord(
    String id,
    String dealId,
    long sequenceNumber,
    String eventType,
    String eventDataJson,
    String actorId,
    String previousHash,
    String eventHash,
    Instant occurredAt) {}
