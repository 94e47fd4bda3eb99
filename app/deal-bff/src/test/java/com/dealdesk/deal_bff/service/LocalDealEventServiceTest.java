/*
 * どこで: LocalDealEventService の統合テスト
 * 何を: 連番・previous_hash の連結と、同時追記時の直列化を検証する
 * なぜ: 読み戻したローカル監査チェーンがそのまま検証を通ることを保証するため
 */
package com.dealdesk.deal_bff.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.dealdesk.deal_bff.AbstractPostgresContainerTest;
import com.dealdesk.deal_bff.model.AuditEvent;
import com.dealdesk.deal_bff.model.AuditSource;
import com.dealdesk.deal_bff.model.ChainVerification;
import com.dealdesk.deal_bff.model.LocalDealEventRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class LocalDealEventServiceTest extends AbstractPostgresContainerTest {

  @Autowired private LocalDealEventService localDealEventService;

  @Autowired private HashChainVerifier hashChainVerifier;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private ObjectMapper objectMapper;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM deal_events", new MapSqlParameterSource());
  }

  @Test
  void appendLinksEachEventToItsPredecessor() throws Exception {
    final LocalDealEventRecord first =
        localDealEventService.append(
            "D1", "ACTION_OPEN_REVIEW", objectMapper.readTree("{\"b\":2,\"a\":1}"), "A1");
    final LocalDealEventRecord second =
        localDealEventService.append(
            "D1", "ACTION_APPROVE_DEAL", objectMapper.createObjectNode(), "A2");

    assertThat(first.sequenceNumber()).isEqualTo(1L);
    assertThat(first.previousHash()).isNull();
    assertThat(second.sequenceNumber()).isEqualTo(2L);
    assertThat(second.previousHash()).isEqualTo(first.eventHash());

    final List<LocalDealEventRecord> stored = localDealEventService.listEvents("D1");
    assertThat(stored)
        .extracting(LocalDealEventRecord::id)
        .containsExactly(first.id(), second.id());
    assertThat(stored.get(0).occurredAt()).isEqualTo(first.occurredAt());
  }

  @Test
  void storedHashCanBeRecomputedFromReadBackRow() throws Exception {
    localDealEventService.append(
        "D1", "ACTION_OPEN_REVIEW", objectMapper.readTree("{\"note\":\"x\",\"n\":3}"), "A1");

    final LocalDealEventRecord stored = localDealEventService.listEvents("D1").get(0);
    final String recomputed =
        localDealEventService.computeHash(
            stored.dealId(),
            stored.sequenceNumber(),
            stored.eventType(),
            objectMapper.readTree(stored.eventDataJson()),
            stored.previousHash(),
            stored.occurredAt());

    assertThat(recomputed).isEqualTo(stored.eventHash());
  }

  @Test
  void dealsHaveIndependentChains() {
    localDealEventService.append(
        "D1", "ACTION_OPEN_REVIEW", objectMapper.createObjectNode(), "A1");
    final LocalDealEventRecord other =
        localDealEventService.append(
            "D2", "ACTION_OPEN_REVIEW", objectMapper.createObjectNode(), "A1");

    assertThat(other.sequenceNumber()).isEqualTo(1L);
    assertThat(other.previousHash()).isNull();
  }

  @Test
  void concurrentAppendsProduceAGaplessChain() throws Exception {
    final int writers = 6;
    final ExecutorService executor = Executors.newFixedThreadPool(writers);
    try {
      final List<Future<LocalDealEventRecord>> futures = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        final int index = i;
        futures.add(
            executor.submit(
                () ->
                    localDealEventService.append(
                        "D1",
                        "ACTION_OPEN_REVIEW",
                        objectMapper.createObjectNode().put("writer", index),
                        "A" + index)));
      }
      for (Future<LocalDealEventRecord> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    final List<LocalDealEventRecord> stored = localDealEventService.listEvents("D1");
    assertThat(stored)
        .extracting(LocalDealEventRecord::sequenceNumber)
        .containsExactly(1L, 2L, 3L, 4L, 5L, 6L);
    for (int i = 1; i < stored.size(); i++) {
      assertThat(stored.get(i).previousHash()).isEqualTo(stored.get(i - 1).eventHash());
    }
  }

  @Test
  void tamperedRowIsReportedByVerification() {
    for (int i = 0; i < 3; i++) {
      localDealEventService.append(
          "D1", "ACTION_OPEN_REVIEW", objectMapper.createObjectNode(), "A1");
    }
    jdbcTemplate.update(
        "UPDATE deal_events SET event_hash = 'tampered'"
            + " WHERE deal_id = 'D1' AND sequence_number = 2",
        new MapSqlParameterSource());

    final ChainVerification verification = verifyLocalChain();

    assertThat(verification.valid()).isFalse();
    assertThat(verification.issues())
        .singleElement()
        .satisfies(issue -> assertThat(issue.message()).isEqualTo("Chain break at sequence 3"));
  }

  private ChainVerification verifyLocalChain() {
    final List<AuditEvent> events =
        localDealEventService.listEvents("D1").stream()
            .map(
                record ->
                    new AuditEvent(
                        AuditSource.LOCAL,
                        record.id(),
                        record.sequenceNumber(),
                        record.eventHash(),
                        record.previousHash(),
                        record.eventType(),
                        null,
                        record.actorId(),
                        record.occurredAt()))
            .toList();
    return hashChainVerifier.verifyChain(events);
  }
}
