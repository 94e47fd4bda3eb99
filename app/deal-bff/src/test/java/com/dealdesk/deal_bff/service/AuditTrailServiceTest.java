/*
 * どこで: Deal-BFF サービス層テスト
 * 何を: 監査タイムラインの絞り込み・ページング、検証レポート、集計を検証する
 * なぜ: authority 障害時もローカル監査を返し、整合性判定が絞り込みに左右されないことを保証するため
 */
package com.dealdesk.deal_bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.dealdesk.deal_bff.model.AuditEvent;
import com.dealdesk.deal_bff.model.AuditSource;
import com.dealdesk.deal_bff.model.AuditSourceFilter;
import com.dealdesk.deal_bff.model.AuditSummary;
import com.dealdesk.deal_bff.model.AuditTrailPage;
import com.dealdesk.deal_bff.model.AuditTrailQuery;
import com.dealdesk.deal_bff.model.AuditVerificationReport;
import com.dealdesk.deal_bff.model.ChainIssue;
import com.dealdesk.deal_bff.model.LocalDealEventRecord;
import com.dealdesk.deal_bff.service.dto.AuthorityChainReport;
import com.dealdesk.deal_bff.service.dto.AuthorityEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class AuditTrailServiceTest {

  private static final Instant BASE = Instant.parse("2026-01-17T00:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private LocalDealEventService localDealEventService;
  private AuthorityClient authorityClient;
  private AuditTrailService service;

  @BeforeEach
  void setUp() {
    localDealEventService = Mockito.mock(LocalDealEventService.class);
    authorityClient = Mockito.mock(AuthorityClient.class);
    service =
        new AuditTrailService(
            localDealEventService,
            authorityClient,
            new AuditTrailMerger(),
            new HashChainVerifier(),
            objectMapper,
            Clock.fixed(BASE.plusSeconds(3600), ZoneOffset.UTC));
  }

  @Test
  void auditTrailMergesFiltersAndPaginates() {
    when(localDealEventService.listEvents("D1"))
        .thenReturn(
            List.of(
                local(1, null, "ACTION_OPEN_REVIEW", 10),
                local(2, "l1", "ACTION_APPROVE_DEAL", 30)));
    when(authorityClient.listEvents("D1"))
        .thenReturn(
            List.of(
                authority(1, null, "DealCreated", 0),
                authority(2, "a1", "ReviewOpened", 20),
                authority(3, "a2", "DealApproved", 40)));

    final AuditTrailPage page =
        service.getAuditTrail(
            "D1", new AuditTrailQuery(2, 1, null, null, null, AuditSourceFilter.ALL));

    assertThat(page.events()).extracting(AuditEvent::id).containsExactly("l2", "a2");
    assertThat(page.pagination().total()).isEqualTo(5);
    assertThat(page.pagination().hasMore()).isTrue();
    assertThat(page.integrity().localChainValid()).isTrue();
    assertThat(page.integrity().authorityChainValid()).isTrue();
    assertThat(page.integrity().authorityEventCount()).isEqualTo(3);
  }

  @Test
  void filtersDoNotAffectIntegrity() {
    when(localDealEventService.listEvents("D1"))
        .thenReturn(List.of(local(1, null, "ACTION_OPEN_REVIEW", 10)));
    when(authorityClient.listEvents("D1"))
        .thenReturn(
            List.of(authority(1, null, "DealCreated", 0), authority(3, "a2", "DealApproved", 40)));

    final AuditTrailPage page =
        service.getAuditTrail(
            "D1",
            new AuditTrailQuery(
                10,
                0,
                Set.of("ACTION_OPEN_REVIEW"),
                BASE,
                BASE.plusSeconds(15),
                AuditSourceFilter.LOCAL));

    assertThat(page.events()).extracting(AuditEvent::id).containsExactly("l1");
    assertThat(page.pagination().hasMore()).isFalse();
    assertThat(page.integrity().authorityChainValid()).isFalse();
    assertThat(page.integrity().authorityEventCount()).isEqualTo(2);
  }

  @Test
  void unavailableAuthorityStillReturnsLocalTrail() {
    when(localDealEventService.listEvents("D1"))
        .thenReturn(List.of(local(1, null, "ACTION_OPEN_REVIEW", 10)));
    when(authorityClient.listEvents("D1"))
        .thenThrow(
            new AuthorityIntegrationException(
                AuthorityIntegrationException.Reason.UNAVAILABLE, "down", null));

    final AuditTrailPage page = service.getAuditTrail("D1", AuditTrailQuery.defaults());

    assertThat(page.events()).extracting(AuditEvent::source).containsExactly(AuditSource.LOCAL);
    assertThat(page.integrity().authorityAvailable()).isFalse();
    assertThat(page.integrity().authorityChainValid()).isFalse();
    assertThat(page.integrity().localChainValid()).isTrue();
  }

  @Test
  void verifyCombinesRecomputedChainWithAuthorityReport() {
    when(localDealEventService.listEvents("D1"))
        .thenReturn(List.of(local(1, null, "ACTION_OPEN_REVIEW", 10)));
    when(authorityClient.listEvents("D1"))
        .thenReturn(
            List.of(authority(1, null, "DealCreated", 0), authority(2, "a1", "ReviewOpened", 5)));
    when(authorityClient.verifyEvents("D1"))
        .thenReturn(
            new AuthorityChainReport(
                false,
                List.of(
                    objectMapper
                        .createObjectNode()
                        .put("sequenceNumber", 2)
                        .put("eventId", "a2")
                        .put("message", "hash mismatch")),
                2));

    final AuditVerificationReport report = service.verify("D1");

    assertThat(report.overallValid()).isFalse();
    assertThat(report.local().valid()).isTrue();
    assertThat(report.authority().valid()).isFalse();
    assertThat(report.authority().totalEvents()).isEqualTo(2);
    assertThat(report.authority().issues())
        .singleElement()
        .satisfies(
            issue -> {
              assertThat(issue.type()).isEqualTo(ChainIssue.Type.AUTHORITY_REPORTED);
              assertThat(issue.sequenceNumber()).isEqualTo(2L);
              assertThat(issue.message()).isEqualTo("hash mismatch");
            });
    assertThat(report.verifiedAt()).isEqualTo(BASE.plusSeconds(3600));
  }

  @Test
  void verifyMarksAuthorityInvalidWhenUnavailable() {
    when(localDealEventService.listEvents("D1")).thenReturn(List.of());
    when(authorityClient.listEvents("D1"))
        .thenThrow(
            new AuthorityIntegrationException(
                AuthorityIntegrationException.Reason.TIMEOUT, "timeout", null));

    final AuditVerificationReport report = service.verify("D1");

    assertThat(report.local().valid()).isTrue();
    assertThat(report.overallValid()).isFalse();
    assertThat(report.authority().issues())
        .extracting(ChainIssue::type)
        .containsExactly(ChainIssue.Type.UNAVAILABLE);
  }

  @Test
  void summaryCountsEventsPerSource() {
    when(localDealEventService.listEvents("D1"))
        .thenReturn(
            List.of(
                local(1, null, "ACTION_OPEN_REVIEW", 10),
                local(2, "l1", "ACTION_OPEN_REVIEW", 30)));
    when(authorityClient.listEvents("D1"))
        .thenReturn(List.of(authority(1, null, "DealCreated", 0)));

    final AuditSummary summary = service.summarize("D1");

    assertThat(summary.combinedTotal()).isEqualTo(3);
    assertThat(summary.local().byType()).containsEntry("ACTION_OPEN_REVIEW", 2L);
    assertThat(summary.local().lastEventAt()).isEqualTo(BASE.plusSeconds(30));
    assertThat(summary.authority().total()).isEqualTo(1);
    assertThat(summary.authorityAvailable()).isTrue();
  }

  private LocalDealEventRecord local(long sequence, String previousHash, String type, long second) {
    return new LocalDealEventRecord(
        "l" + sequence,
        "D1",
        sequence,
        type,
        "{\"actionType\":\"OPEN_REVIEW\"}",
        "A1",
        previousHash,
        "l" + sequence,
        BASE.plusSeconds(second));
  }

  private AuthorityEvent authority(long sequence, String previousHash, String type, long second) {
    return new AuthorityEvent(
        "a" + sequence,
        "D1",
        type,
        "A1",
        objectMapper.createObjectNode(),
        BASE.plusSeconds(second),
        sequence,
        "a" + sequence,
        previousHash);
  }
}
