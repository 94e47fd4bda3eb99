package com.dealdesk.deal_bff.model;

import com.fasterxml.jackson.databind.JsonNode;

/** A client's request to run {@code actionType} on a deal as {@code actorId}. */
public record ActionCommand(String dealId, String actionType, String actorId, JsonNode payload) {

  public ActionCommand {
    payload = payload == null ? null : payload.deepCopy();
  }

  @Override
  public JsonNode payload() {
    return payload == null ? null : payload.deepCopy();
  }
}
