/*
 * どこで: Deal-BFF API
 * 何を: 統合監査タイムライン・チェーン検証・集計を公開する
 * なぜ: 運用者がローカルと authority の監査ログを 1 か所で確認できるようにするため
 */
package com.dealdesk.deal_bff.api;

import com.dealdesk.deal_bff.model.AuditSourceFilter;
import com.dealdesk.deal_bff.model.AuditSummary;
import com.dealdesk.deal_bff.model.AuditTrailPage;
import com.dealdesk.deal_bff.model.AuditTrailQuery;
import com.dealdesk.deal_bff.model.AuditVerificationReport;
import com.dealdesk.deal_bff.service.AuditTrailService;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/deals/{dealId}/audit-trail")
@RequiredArgsConstructor
@Validated
public class AuditTrailController {

  private final AuditTrailService auditTrailService;

  @GetMapping
  public ResponseEntity<AuditTrailPage> getAuditTrail(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId,
      @RequestParam(name = "limit", defaultValue = "100") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset,
      @RequestParam(name = "types", required = false) List<String> types,
      @RequestParam(name = "startDate", required = false) Instant startDate,
      @RequestParam(name = "endDate", required = false) Instant endDate,
      @RequestParam(name = "source", defaultValue = "ALL") AuditSourceFilter source) {
    final AuditTrailQuery query =
        new AuditTrailQuery(
            limit, offset, types == null ? Set.of() : Set.copyOf(types), startDate, endDate, source);
    return ResponseEntity.ok(auditTrailService.getAuditTrail(dealId, query));
  }

  @GetMapping("/verify")
  public ResponseEntity<AuditVerificationReport> verify(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId) {
    return ResponseEntity.ok(auditTrailService.verify(dealId));
  }

  @GetMapping("/summary")
  public ResponseEntity<AuditSummary> summarize(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId) {
    return ResponseEntity.ok(auditTrailService.summarize(dealId));
  }
}
