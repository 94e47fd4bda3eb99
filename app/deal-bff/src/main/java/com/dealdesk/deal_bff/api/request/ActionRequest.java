package com.dealdesk.deal_bff.api.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

public record ActionRequest(
    @NotBlank(message = "actorId is required") String actorId, JsonNode payload) {}
