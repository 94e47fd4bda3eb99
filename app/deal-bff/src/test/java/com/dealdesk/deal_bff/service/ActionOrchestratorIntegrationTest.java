/*
 * どこで: ActionOrchestrator の統合テスト
 * 何を: 実 DB の冪等性台帳とローカル監査チェーンを通した exactly-once 実行を検証する
 * なぜ: プロセス内キャッシュではなく DB 上の台帳から再送応答が返ることを保証するため
 */
package com.dealdesk.deal_bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dealdesk.deal_bff.AbstractPostgresContainerTest;
import com.dealdesk.deal_bff.model.ActionCommand;
import com.dealdesk.deal_bff.model.ActionOutcome;
import com.dealdesk.deal_bff.model.LocalDealEventRecord;
import com.dealdesk.deal_bff.service.dto.AuthorityAppendResult;
import com.dealdesk.deal_bff.service.dto.AuthorityExplanation;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class ActionOrchestratorIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private ActionOrchestrator actionOrchestrator;

  @Autowired private LocalDealEventService localDealEventService;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private AuthorityClient authorityClient;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM action_idempotency", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM deal_events", new MapSqlParameterSource());
  }

  @Test
  void repeatedActionIsReplayedFromLedger() {
    when(authorityClient.explain(eq("D1"), eq("APPROVE_DEAL"), eq("A1"), any()))
        .thenReturn(
            new AuthorityExplanation(
                objectMapper
                    .createObjectNode()
                    .put("status", "ALLOWED")
                    .put("action", "APPROVE_DEAL")));
    when(authorityClient.act(eq("D1"), eq("DealApproved"), eq("A1"), any()))
        .thenReturn(
            new AuthorityAppendResult(
                objectMapper
                    .createObjectNode()
                    .put("id", "evt-1")
                    .put("type", "DealApproved")
                    .put("sequenceNumber", 5L)
                    .put("eventHash", "h5")
                    .put("previousEventHash", "h4")));
    final ActionCommand command =
        new ActionCommand("D1", "APPROVE_DEAL", "A1", objectMapper.createObjectNode());

    final ActionOutcome first = actionOrchestrator.execute(command);
    final ActionOutcome second = actionOrchestrator.execute(command);

    assertThat(first.statusCode()).isEqualTo(200);
    assertThat(second.body()).isEqualTo(first.body());
    assertThat(second.appendedEventId()).isEqualTo("evt-1");
    verify(authorityClient, times(1)).act(anyString(), anyString(), anyString(), any());

    final List<LocalDealEventRecord> localEvents = localDealEventService.listEvents("D1");
    assertThat(localEvents).hasSize(1);
    assertThat(localEvents.get(0).eventType()).isEqualTo("ACTION_APPROVE_DEAL");
    assertThat(countLedgerRows()).isEqualTo(1);
  }

  @Test
  void blockedActionIsPersistedWithoutLocalEvent() {
    when(authorityClient.explain(eq("D1"), eq("APPROVE_DEAL"), eq("A1"), any()))
        .thenReturn(
            new AuthorityExplanation(
                objectMapper
                    .createObjectNode()
                    .put("status", "BLOCKED")
                    .put("action", "APPROVE_DEAL")));

    final ActionOutcome outcome =
        actionOrchestrator.execute(
            new ActionCommand("D1", "APPROVE_DEAL", "A1", objectMapper.createObjectNode()));

    assertThat(outcome.statusCode()).isEqualTo(409);
    assertThat(countLedgerRows()).isEqualTo(1);
    assertThat(localDealEventService.listEvents("D1")).isEmpty();
  }

  private Integer countLedgerRows() {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM action_idempotency", new MapSqlParameterSource(), Integer.class);
  }
}
