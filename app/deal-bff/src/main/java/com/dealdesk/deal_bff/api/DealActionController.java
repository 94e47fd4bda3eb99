/*
 * どこで: Deal-BFF API
 * 何を: deal アクションの実行と事前説明 (explain) を公開する
 * なぜ: クライアントが authority を直接呼ばず、冪等性付きの BFF 経由で状態変更できるようにするため
 */
package com.dealdesk.deal_bff.api;

import com.dealdesk.deal_bff.api.request.ActionRequest;
import com.dealdesk.deal_bff.api.request.ExplainRequest;
import com.dealdesk.deal_bff.model.ActionCommand;
import com.dealdesk.deal_bff.model.ActionOutcome;
import com.dealdesk.deal_bff.service.ActionOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/deals")
@RequiredArgsConstructor
@Validated
public class DealActionController {

  private final ActionOrchestrator actionOrchestrator;

  @PostMapping("/{dealId}/actions/{actionType}")
  public ResponseEntity<JsonNode> executeAction(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId,
      @PathVariable("actionType") @NotBlank(message = "actionType is required") String actionType,
      @Valid @RequestBody ActionRequest request) {
    final ActionOutcome outcome =
        actionOrchestrator.execute(
            new ActionCommand(dealId, actionType, request.actorId(), request.payload()));
    // BLOCKED(409) も正常系の結果として本文ごと返す
    return ResponseEntity.status(outcome.statusCode()).body(outcome.body());
  }

  @PostMapping("/{dealId}/explain")
  public ResponseEntity<JsonNode> explain(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId,
      @Valid @RequestBody ExplainRequest request) {
    return ResponseEntity.ok(
        actionOrchestrator
            .explain(
                new ActionCommand(
                    dealId, request.actionType(), request.actorId(), request.payload()))
            .body());
  }
}
