/*
 * どこで: Deal-BFF サービス層
 * 何を: 更新が確定した deal のキャッシュを prefix 単位でまとめて破棄する
 * なぜ: アクション直後の読み取りで古いスナップショットやイベント一覧を返さないため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.common.cache.TtlCache;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DealCacheInvalidator {

  private static final Logger logger = LoggerFactory.getLogger(DealCacheInvalidator.class);

  private final TtlCache<JsonNode> dealReadCache;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TtlCache は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public DealCacheInvalidator(TtlCache<JsonNode> dealReadCache) {
    this.dealReadCache = dealReadCache;
  }

  public int invalidateDeal(String dealId) {
    final int removed = dealReadCache.deleteByPrefix(DealCacheKeys.dealPrefix(dealId));
    logger.debug("invalidated deal cache dealId={} removed={}", dealId, removed);
    return removed;
  }
}
