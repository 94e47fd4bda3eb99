package com.dealdesk.deal_bff.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Body of {@code POST /deals/{id}/explain}. */
public record AuthorityExplainRequest(
    String action,
    String actorId,
    JsonNode payload,
    JsonNode authorityContext,
    List<String> evidenceRefs) {

  public AuthorityExplainRequest {
    evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
  }
}
