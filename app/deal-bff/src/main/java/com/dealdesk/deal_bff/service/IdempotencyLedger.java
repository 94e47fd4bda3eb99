/*
 * どこで: Deal-BFF サービス層
 * 何を: アクション結果の永続台帳 (取得時に期限切れを掃除し、保存は後勝ち) を提供する
 * なぜ: 「このアクションは既に実行済みか」の正をプロセス外の DB に置き、再送を副作用なしで返すため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.deal_bff.config.IdempotencyProperties;
import com.dealdesk.deal_bff.model.ActionOutcome;
import com.dealdesk.deal_bff.model.IdempotencyKey;
import com.dealdesk.deal_bff.model.IdempotencyRecord;
import com.dealdesk.deal_bff.repository.ActionIdempotencyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdempotencyLedger {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyLedger.class);

  private final ActionIdempotencyRepository repository;
  private final IdempotencyProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** Prunes expired entries, then looks up the outcome stored for the key. */
  public Optional<ActionOutcome> get(IdempotencyKey key) {
    final Instant now = clock.instant();
    final int pruned = repository.deleteExpired(now);
    if (pruned > 0) {
      logger.debug("pruned expired idempotency entries count={}", pruned);
    }
    return repository.findByKey(key.value(), now).map(this::toOutcome);
  }

  public IdempotencyRecord upsert(IdempotencyKey key, ActionOutcome outcome) {
    final Instant now = clock.instant();
    final IdempotencyRecord record =
        new IdempotencyRecord(
            key.value(),
            key.dealId(),
            key.actionType(),
            key.actorId(),
            key.payloadHash(),
            outcome.statusCode(),
            writeJson(outcome.body()),
            outcome.appendedEventId(),
            now,
            now.plus(properties.ttl()));
    repository.upsert(record);
    logger.info(
        "stored action outcome key={} status={} appendedEventId={} expiresAt={}",
        record.idempotencyKey(),
        record.statusCode(),
        record.appendedEventId(),
        record.expiresAt());
    return record;
  }

  private ActionOutcome toOutcome(IdempotencyRecord record) {
    return new ActionOutcome(
        record.statusCode(), readJson(record.responseBodyJson()), record.appendedEventId());
  }

  private String writeJson(JsonNode body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize action outcome", ex);
    }
  }

  private JsonNode readJson(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize stored action outcome", ex);
    }
  }
}
