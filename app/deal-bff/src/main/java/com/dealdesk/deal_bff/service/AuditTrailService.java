/*
 * どこで: Deal-BFF サービス層
 * 何を: ローカル/authority の監査チェーンを取得し、統合タイムライン・検証レポート・集計を返す
 * なぜ: 2 つの独立したハッシュチェーンを 1 つの監査画面で確認・検証できるようにするため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.deal_bff.model.AuditEvent;
import com.dealdesk.deal_bff.model.AuditSource;
import com.dealdesk.deal_bff.model.AuditSummary;
import com.dealdesk.deal_bff.model.AuditTrailPage;
import com.dealdesk.deal_bff.model.AuditTrailQuery;
import com.dealdesk.deal_bff.model.AuditVerificationReport;
import com.dealdesk.deal_bff.model.AuthorityChainVerification;
import com.dealdesk.deal_bff.model.ChainIssue;
import com.dealdesk.deal_bff.model.ChainVerification;
import com.dealdesk.deal_bff.model.LocalDealEventRecord;
import com.dealdesk.deal_bff.service.dto.AuthorityChainReport;
import com.dealdesk.deal_bff.service.dto.AuthorityEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditTrailService {

  private static final Logger logger = LoggerFactory.getLogger(AuditTrailService.class);

  private final LocalDealEventService localDealEventService;
  private final AuthorityClient authorityClient;
  private final AuditTrailMerger auditTrailMerger;
  private final HashChainVerifier hashChainVerifier;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AuditTrailPage getAuditTrail(String dealId, AuditTrailQuery query) {
    final List<AuditEvent> localEvents = loadLocalEvents(dealId);
    final AuthorityEvents authority = loadAuthorityEvents(dealId);

    // 整合性は絞り込み前のチェーン全体で判定する
    final ChainVerification localChain = hashChainVerifier.verifyChain(localEvents);
    final ChainVerification authorityChain = hashChainVerifier.verifyChain(authority.events());

    final List<AuditEvent> filtered =
        auditTrailMerger.merge(localEvents, authority.events()).stream()
            .filter(query::matches)
            .toList();
    final int total = filtered.size();
    final int from = Math.min(query.offset(), total);
    final int to = Math.min(from + query.limit(), total);

    return new AuditTrailPage(
        dealId,
        filtered.subList(from, to),
        new AuditTrailPage.Pagination(total, query.limit(), query.offset(), to < total),
        new AuditTrailPage.Integrity(
            localChain.valid(),
            authority.available() && authorityChain.valid(),
            localEvents.size(),
            authority.events().size(),
            authority.available()));
  }

  public AuditVerificationReport verify(String dealId) {
    final ChainVerification local = hashChainVerifier.verifyChain(loadLocalEvents(dealId));
    final AuthorityChainVerification authority = verifyAuthority(dealId);
    final boolean overallValid = local.valid() && authority.valid();
    if (!overallValid) {
      logger.warn(
          "audit chain verification failed dealId={} localIssues={} authorityIssues={}",
          dealId,
          local.issues().size(),
          authority.issues().size());
    }
    return new AuditVerificationReport(dealId, overallValid, local, authority, clock.instant());
  }

  public AuditSummary summarize(String dealId) {
    final List<AuditEvent> localEvents = loadLocalEvents(dealId);
    final AuthorityEvents authority = loadAuthorityEvents(dealId);
    final AuditSummary.SourceSummary localSummary = summarizeSource(localEvents);
    final AuditSummary.SourceSummary authoritySummary = summarizeSource(authority.events());
    return new AuditSummary(
        dealId,
        localSummary,
        authoritySummary,
        localSummary.total() + authoritySummary.total(),
        authority.available());
  }

  private AuthorityChainVerification verifyAuthority(String dealId) {
    final List<AuditEvent> events;
    final AuthorityChainReport report;
    try {
      events = toAuthorityAuditEvents(authorityClient.listEvents(dealId));
      report = authorityClient.verifyEvents(dealId);
    } catch (AuthorityIntegrationException ex) {
      logger.warn(
          "authority chain verification unavailable dealId={} reason={}", dealId, ex.reason());
      return new AuthorityChainVerification(
          false,
          0,
          List.of(
              new ChainIssue(
                  ChainIssue.Type.UNAVAILABLE,
                  null,
                  null,
                  "Authority verification unavailable: " + ex.getMessage())),
          null);
    }
    final ChainVerification recomputed = hashChainVerifier.verifyChain(events);
    final List<ChainIssue> issues = new ArrayList<>(recomputed.issues());
    for (JsonNode reported : report.issues()) {
      issues.add(toReportedIssue(reported));
    }
    return new AuthorityChainVerification(
        recomputed.valid() && report.valid(), recomputed.eventCount(), issues, report.totalEvents());
  }

  private List<AuditEvent> loadLocalEvents(String dealId) {
    return localDealEventService.listEvents(dealId).stream().map(this::toAuditEvent).toList();
  }

  private AuthorityEvents loadAuthorityEvents(String dealId) {
    try {
      return new AuthorityEvents(toAuthorityAuditEvents(authorityClient.listEvents(dealId)), true);
    } catch (AuthorityIntegrationException ex) {
      // authority が使えなくてもローカル側の監査は返す
      logger.warn(
          "authority events unavailable for audit trail dealId={} reason={}",
          dealId,
          ex.reason());
      return new AuthorityEvents(List.of(), false);
    }
  }

  private List<AuditEvent> toAuthorityAuditEvents(List<AuthorityEvent> events) {
    return events.stream().map(this::toAuditEvent).toList();
  }

  private AuditEvent toAuditEvent(LocalDealEventRecord record) {
    return new AuditEvent(
        AuditSource.LOCAL,
        record.id(),
        record.sequenceNumber(),
        record.eventHash(),
        record.previousHash(),
        record.eventType(),
        readJson(record.eventDataJson()),
        record.actorId(),
        record.occurredAt());
  }

  private AuditEvent toAuditEvent(AuthorityEvent event) {
    return new AuditEvent(
        AuditSource.AUTHORITY,
        event.id(),
        event.sequenceNumber(),
        event.eventHash(),
        event.previousEventHash(),
        event.type(),
        event.payload(),
        event.actorId(),
        event.createdAt());
  }

  private ChainIssue toReportedIssue(JsonNode reported) {
    final JsonNode sequence = reported.get("sequenceNumber");
    final JsonNode eventId = reported.get("eventId");
    final JsonNode message = reported.get("message");
    return new ChainIssue(
        ChainIssue.Type.AUTHORITY_REPORTED,
        sequence != null && sequence.canConvertToLong() ? sequence.asLong() : null,
        eventId != null && eventId.isTextual() ? eventId.asText() : null,
        message != null && message.isTextual() ? message.asText() : reported.toString());
  }

  private AuditSummary.SourceSummary summarizeSource(List<AuditEvent> events) {
    final Map<String, Long> byType =
        events.stream()
            .map(AuditEvent::eventType)
            .filter(Objects::nonNull)
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    final Instant lastEventAt =
        events.stream()
            .map(AuditEvent::occurredAt)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
    return new AuditSummary.SourceSummary(events.size(), byType, lastEventAt);
  }

  private JsonNode readJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize local deal event data", ex);
    }
  }

  private record AuthorityEvents(List<AuditEvent> events, boolean available) {}
}
