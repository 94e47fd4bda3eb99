/*
 * どこで: Deal-BFF モデル
 * 何を: deal/アクション種別/actor/payload ハッシュから成る冪等性キーを表す
 * なぜ: 台帳キーと coalescing キーの書式を 1 か所に固定するため
 */
package com.dealdesk.deal_bff.model;

public record IdempotencyKey(String dealId, String actionType, String actorId, String payloadHash) {

  private static final String COALESCING_PREFIX = "idempotency:";

  public String value() {
    return dealId + ":" + actionType + ":" + actorId + ":" + payloadHash;
  }

  public String coalescingKey() {
    return COALESCING_PREFIX + value();
  }

  @Override
  public String toString() {
    return value();
  }
}
