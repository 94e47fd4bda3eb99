/*
 * どこで: Deal-BFF API
 * 何を: authority のスナップショットとイベント一覧をキャッシュ経由で公開する
 * なぜ: 画面の連続読み取りを BFF のキャッシュで吸収するため
 */
package com.dealdesk.deal_bff.api;

import com.dealdesk.deal_bff.service.DealReadService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/deals")
@RequiredArgsConstructor
@Validated
public class DealReadController {

  private final DealReadService dealReadService;

  @GetMapping("/{dealId}/snapshot")
  public ResponseEntity<JsonNode> getSnapshot(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId) {
    return ResponseEntity.ok(dealReadService.getSnapshot(dealId));
  }

  @GetMapping("/{dealId}/events")
  public ResponseEntity<JsonNode> getEvents(
      @PathVariable("dealId") @NotBlank(message = "dealId is required") String dealId) {
    return ResponseEntity.ok(dealReadService.getAuthorityEvents(dealId));
  }
}
