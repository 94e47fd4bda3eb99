package com.dealdesk.deal_bff.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ActionBlockedBody(String status, String action, JsonNode explain) {

  public static final String STATUS = "BLOCKED";

  public ActionBlockedBody {
    explain = explain == null ? null : explain.deepCopy();
  }

  public static ActionBlockedBody of(String action, JsonNode explain) {
    return new ActionBlockedBody(STATUS, action, explain);
  }

  @Override
  public JsonNode explain() {
    return explain == null ? null : explain.deepCopy();
  }
}
