package com.dealdesk.deal_bff.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Body of {@code POST /deals/{id}/events}. */
public record AuthorityEventRequest(
    String type,
    String actorId,
    JsonNode payload,
    JsonNode authorityContext,
    List<String> evidenceRefs) {

  public AuthorityEventRequest {
    evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
  }
}
