/*
 * どこで: Deal-BFF サービス層
 * 何を: authority サービスの HTTP 面 (explain / events / verify / snapshot) を呼び出す
 * なぜ: 下流失敗を UNAVAILABLE と REJECTED に分類し、呼び出し側が再試行可否を判断できるようにするため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.deal_bff.config.AuthorityClientProperties;
import com.dealdesk.deal_bff.service.dto.AuthorityAppendResult;
import com.dealdesk.deal_bff.service.dto.AuthorityChainReport;
import com.dealdesk.deal_bff.service.dto.AuthorityEvent;
import com.dealdesk.deal_bff.service.dto.AuthorityEventRequest;
import com.dealdesk.deal_bff.service.dto.AuthorityExplainRequest;
import com.dealdesk.deal_bff.service.dto.AuthorityExplanation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class AuthorityClient {

  private static final Logger logger = LoggerFactory.getLogger(AuthorityClient.class);

  static final String OPERATION_EXPLAIN = "explain";
  static final String OPERATION_ACT = "act";
  static final String OPERATION_LIST_EVENTS = "list_events";
  static final String OPERATION_VERIFY_EVENTS = "verify_events";
  static final String OPERATION_SNAPSHOT = "snapshot";

  private final RestClient authorityRestClient;
  private final AuthorityClientProperties properties;
  private final ObjectMapper objectMapper;
  private final BffMetrics bffMetrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper/BffMetrics は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public AuthorityClient(
      RestClient authorityRestClient,
      AuthorityClientProperties properties,
      ObjectMapper objectMapper,
      BffMetrics bffMetrics) {
    this.authorityRestClient = authorityRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.bffMetrics = bffMetrics;
  }

  public AuthorityExplanation explain(
      String dealId, String action, String actorId, JsonNode payload) {
    requireText(dealId, "dealId");
    requireText(action, "action");
    final AuthorityExplainRequest body =
        new AuthorityExplainRequest(
            action, actorId, payload, objectMapper.createObjectNode(), List.of());
    final JsonNode response =
        execute(
            OPERATION_EXPLAIN,
            dealId,
            () ->
                authorityRestClient
                    .post()
                    .uri(properties.explainPath(), dealId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toEntity(JsonNode.class));
    if (response == null || !response.hasNonNull("status")) {
      throw invalidResponse(OPERATION_EXPLAIN, "authority explain response has no status");
    }
    return new AuthorityExplanation(response);
  }

  /**
   * Appends an event at the authority. Any 2xx means the event is committed, so the body is
   * returned as-is even when it is empty, not JSON, or has no id.
   */
  public AuthorityAppendResult act(
      String dealId, String eventType, String actorId, JsonNode payload) {
    requireText(dealId, "dealId");
    requireText(eventType, "eventType");
    final AuthorityEventRequest body =
        new AuthorityEventRequest(
            eventType, actorId, payload, objectMapper.createObjectNode(), List.of());
    final String rawBody =
        execute(
            OPERATION_ACT,
            dealId,
            () ->
                authorityRestClient
                    .post()
                    .uri(properties.eventsPath(), dealId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toEntity(String.class));
    final AuthorityAppendResult result = new AuthorityAppendResult(parseCommittedBody(rawBody));
    if (result.eventId() == null) {
      logger.warn(
          "authority act committed without event id dealId={} eventType={}", dealId, eventType);
    }
    return result;
  }

  public List<AuthorityEvent> listEvents(String dealId) {
    requireText(dealId, "dealId");
    final List<AuthorityEvent> events =
        execute(
            OPERATION_LIST_EVENTS,
            dealId,
            () ->
                authorityRestClient
                    .get()
                    .uri(properties.eventsPath(), dealId)
                    .retrieve()
                    .toEntity(new ParameterizedTypeReference<List<AuthorityEvent>>() {}));
    return events == null ? List.of() : List.copyOf(events);
  }

  public AuthorityChainReport verifyEvents(String dealId) {
    requireText(dealId, "dealId");
    final AuthorityChainReport report =
        execute(
            OPERATION_VERIFY_EVENTS,
            dealId,
            () ->
                authorityRestClient
                    .get()
                    .uri(properties.verifyEventsPath(), dealId)
                    .retrieve()
                    .toEntity(AuthorityChainReport.class));
    if (report == null) {
      throw invalidResponse(OPERATION_VERIFY_EVENTS, "authority verify response is empty");
    }
    return report;
  }

  public JsonNode getSnapshot(String dealId) {
    requireText(dealId, "dealId");
    final JsonNode snapshot =
        execute(
            OPERATION_SNAPSHOT,
            dealId,
            () ->
                authorityRestClient
                    .get()
                    .uri(properties.snapshotPath(), dealId)
                    .retrieve()
                    .toEntity(JsonNode.class));
    if (snapshot == null) {
      throw invalidResponse(OPERATION_SNAPSHOT, "authority snapshot response is empty");
    }
    return snapshot;
  }

  private <T> T execute(String operation, String dealId, Supplier<ResponseEntity<T>> call) {
    final long startedAt = System.nanoTime();
    try {
      final ResponseEntity<T> response = call.get();
      final Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
      logger.info(
          "authority {} dealId={} status={} durationMs={}",
          operation,
          dealId,
          response.getStatusCode().value(),
          elapsed.toMillis());
      bffMetrics.recordAuthorityDuration(operation, "success", elapsed);
      return response.getBody();
    } catch (RestClientResponseException ex) {
      bffMetrics.recordAuthorityDuration(
          operation, "error", Duration.ofNanos(System.nanoTime() - startedAt));
      throw mapResponseException(operation, dealId, ex);
    } catch (ResourceAccessException ex) {
      bffMetrics.recordAuthorityDuration(
          operation, "error", Duration.ofNanos(System.nanoTime() - startedAt));
      throw mapResourceException(operation, dealId, ex);
    } catch (RuntimeException ex) {
      bffMetrics.recordAuthorityDuration(
          operation, "error", Duration.ofNanos(System.nanoTime() - startedAt));
      logger.warn("authority {} response parse failed dealId={}", operation, dealId, ex);
      bffMetrics.recordAuthorityError(
          operation, AuthorityIntegrationException.Reason.INVALID_RESPONSE.name());
      throw new AuthorityIntegrationException(
          AuthorityIntegrationException.Reason.INVALID_RESPONSE,
          "authority " + operation + " response parse failed",
          ex);
    }
  }

  private AuthorityIntegrationException mapResponseException(
      String operation, String dealId, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "authority {} failed with http status={} dealId={} statusText={}",
        operation,
        status,
        dealId,
        ex.getStatusText());
    final JsonNode body = parseErrorBody(ex.getResponseBodyAsString());
    if (ex.getStatusCode().is4xxClientError()) {
      bffMetrics.recordAuthorityError(
          operation, AuthorityIntegrationException.Reason.REJECTED.name());
      return new AuthorityIntegrationException(
          AuthorityIntegrationException.Reason.REJECTED,
          "authority " + operation + " rejected with status " + status,
          status,
          body,
          ex);
    }
    bffMetrics.recordAuthorityError(
        operation, AuthorityIntegrationException.Reason.UNAVAILABLE.name());
    return new AuthorityIntegrationException(
        AuthorityIntegrationException.Reason.UNAVAILABLE,
        "authority " + operation + " failed with status " + status,
        status,
        body,
        ex);
  }

  private AuthorityIntegrationException mapResourceException(
      String operation, String dealId, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("authority {} timed out dealId={}", operation, dealId);
      bffMetrics.recordAuthorityError(
          operation, AuthorityIntegrationException.Reason.TIMEOUT.name());
      return new AuthorityIntegrationException(
          AuthorityIntegrationException.Reason.TIMEOUT,
          "authority " + operation + " request timeout",
          ex);
    }
    logger.warn("authority {} connection failed dealId={}", operation, dealId, ex);
    bffMetrics.recordAuthorityError(
        operation, AuthorityIntegrationException.Reason.UNAVAILABLE.name());
    return new AuthorityIntegrationException(
        AuthorityIntegrationException.Reason.UNAVAILABLE,
        "authority " + operation + " connection failed",
        ex);
  }

  private AuthorityIntegrationException invalidResponse(String operation, String message) {
    logger.warn("authority {} returned invalid response: {}", operation, message);
    bffMetrics.recordAuthorityError(
        operation, AuthorityIntegrationException.Reason.INVALID_RESPONSE.name());
    return new AuthorityIntegrationException(
        AuthorityIntegrationException.Reason.INVALID_RESPONSE, message, null);
  }

  private JsonNode parseCommittedBody(String rawBody) {
    if (isBlank(rawBody)) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(rawBody);
    } catch (JsonProcessingException ex) {
      logger.warn("authority act committed with non-JSON body", ex);
      final ObjectNode wrapped = objectMapper.createObjectNode();
      wrapped.put("raw", rawBody);
      return wrapped;
    }
  }

  private JsonNode parseErrorBody(String rawBody) {
    if (isBlank(rawBody)) {
      return null;
    }
    try {
      return objectMapper.readTree(rawBody);
    } catch (JsonProcessingException ex) {
      // JSON 以外のエラーページでも本文は message として残す
      final ObjectNode wrapped = objectMapper.createObjectNode();
      wrapped.put("message", rawBody);
      return wrapped;
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void requireText(String value, String name) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
