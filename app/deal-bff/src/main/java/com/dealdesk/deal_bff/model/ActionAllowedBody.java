package com.dealdesk.deal_bff.model;

import com.dealdesk.deal_bff.service.dto.AuthorityAppendResult;
import com.fasterxml.jackson.databind.JsonNode;

public record ActionAllowedBody(
    String status, String action, JsonNode event, String appendedEventId) {

  public static final String STATUS = "ALLOWED";

  public static ActionAllowedBody of(String action, AuthorityAppendResult appended) {
    return new ActionAllowedBody(STATUS, action, appended.body(), appended.eventId());
  }
}
