package com.dealdesk.deal_bff.api.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

public record ExplainRequest(
    @NotBlank(message = "actionType is required") String actionType,
    @NotBlank(message = "actorId is required") String actorId,
    JsonNode payload) {}
