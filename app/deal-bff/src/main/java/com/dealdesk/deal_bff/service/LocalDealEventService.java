/*
 * どこで: Deal-BFF サービス層
 * 何を: ローカル監査チェーンへ連番・ハッシュ連結付きでイベントを追記し、一覧を返す
 * なぜ: BFF 側で確定させた操作を authority とは独立に検証可能な形で残すため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.common.hash.CanonicalHasher;
import com.dealdesk.deal_bff.model.LocalDealEventRecord;
import com.dealdesk.deal_bff.repository.LocalDealEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class LocalDealEventService {

  private static final Logger logger = LoggerFactory.getLogger(LocalDealEventService.class);

  private final LocalDealEventRepository repository;
  private final AdvisoryLockKeyGenerator lockKeyGenerator;
  private final CanonicalHasher canonicalHasher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Transactional
  public LocalDealEventRecord append(
      String dealId, String eventType, JsonNode eventData, String actorId) {
    repository.lockDeal(lockKeyGenerator.generate(dealId));
    final Optional<LocalDealEventRecord> latest = repository.findLatest(dealId);
    final long sequenceNumber = latest.map(event -> event.sequenceNumber() + 1).orElse(1L);
    final String previousHash = latest.map(LocalDealEventRecord::eventHash).orElse(null);
    // DB の timestamp 精度に合わせておき、読み戻した値から同じハッシュを再計算できるようにする
    final Instant occurredAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
    final String eventHash =
        computeHash(dealId, sequenceNumber, eventType, eventData, previousHash, occurredAt);
    final LocalDealEventRecord record =
        new LocalDealEventRecord(
            UUID.randomUUID().toString(),
            dealId,
            sequenceNumber,
            eventType,
            writeJson(eventData),
            actorId,
            previousHash,
            eventHash,
            occurredAt);
    repository.insert(record);
    logger.info(
        "appended local deal event dealId={} sequence={} type={}",
        dealId,
        sequenceNumber,
        eventType);
    return record;
  }

  public List<LocalDealEventRecord> listEvents(String dealId) {
    return repository.findByDealId(dealId);
  }

  @VisibleForTesting
  String computeHash(
      String dealId,
      long sequenceNumber,
      String eventType,
      JsonNode eventData,
      String previousHash,
      Instant occurredAt) {
    final Map<String, Object> content = new LinkedHashMap<>();
    content.put("dealId", dealId);
    content.put("sequenceNumber", sequenceNumber);
    content.put("eventType", eventType);
    content.put("eventData", eventData);
    content.put("previousHash", previousHash);
    content.put("occurredAt", occurredAt.toString());
    return canonicalHasher.hash(content);
  }

  private String writeJson(JsonNode eventData) {
    try {
      return objectMapper.writeValueAsString(eventData);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize local deal event", ex);
    }
  }
}
