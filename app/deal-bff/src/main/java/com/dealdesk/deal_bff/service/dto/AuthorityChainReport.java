package com.dealdesk.deal_bff.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Self-verification result returned by {@code GET /deals/{id}/events/verify}. */
public record AuthorityChainReport(boolean valid, List<JsonNode> issues, Integer totalEvents) {

  public AuthorityChainReport {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
