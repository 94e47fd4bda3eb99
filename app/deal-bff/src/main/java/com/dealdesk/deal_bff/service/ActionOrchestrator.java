/*
 * どこで: Deal-BFF サービス層
 * 何を: deal アクションを「explain してから act」の順で 1 回だけ実行し、結果を冪等性台帳へ残す
 * なぜ: 再送・同時重複・authority 障害があっても状態変更の副作用を 1 回に抑えるため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.common.concurrent.InFlightCoalescer;
import com.dealdesk.common.hash.CanonicalHasher;
import com.dealdesk.deal_bff.model.ActionAllowedBody;
import com.dealdesk.deal_bff.model.ActionBlockedBody;
import com.dealdesk.deal_bff.model.ActionCommand;
import com.dealdesk.deal_bff.model.ActionOutcome;
import com.dealdesk.deal_bff.model.IdempotencyKey;
import com.dealdesk.deal_bff.service.dto.AuthorityAppendResult;
import com.dealdesk.deal_bff.service.dto.AuthorityExplanation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Runs a deal action exactly once per idempotency key.
 *
 * <ol>
 *   <li>derive the key from deal, action type, actor and the canonical payload hash
 *   <li>return the stored outcome when the ledger already has one
 *   <li>otherwise coalesce concurrent duplicates and re-check the ledger
 *   <li>explain (with a single fallback to the mapped event type when the action is unknown)
 *   <li>persist BLOCKED, or act and persist ALLOWED, then invalidate the deal's cache entries
 * </ol>
 *
 * <p>Unavailable failures are rethrown and never persisted so that a retry can proceed. Any 2xx
 * from act is committed and persisted, even without an appended event id.
 */
@Service
public class ActionOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(ActionOrchestrator.class);

  static final int ALLOWED_STATUS_CODE = HttpStatus.OK.value();
  static final int BLOCKED_STATUS_CODE = HttpStatus.CONFLICT.value();
  static final String LOCAL_EVENT_PREFIX = "ACTION_";

  private final AuthorityClient authorityClient;
  private final IdempotencyLedger idempotencyLedger;
  private final InFlightCoalescer inFlightCoalescer;
  private final CanonicalHasher canonicalHasher;
  private final ActionVocabulary actionVocabulary;
  private final DealCacheInvalidator dealCacheInvalidator;
  private final LocalDealEventService localDealEventService;
  private final ObjectMapper objectMapper;
  private final BffMetrics bffMetrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "注入されるコンポーネントは Spring 管理の共有インスタンスで防御的コピーが不可能なため")
  public ActionOrchestrator(
      AuthorityClient authorityClient,
      IdempotencyLedger idempotencyLedger,
      InFlightCoalescer inFlightCoalescer,
      CanonicalHasher canonicalHasher,
      ActionVocabulary actionVocabulary,
      DealCacheInvalidator dealCacheInvalidator,
      LocalDealEventService localDealEventService,
      ObjectMapper objectMapper,
      BffMetrics bffMetrics) {
    this.authorityClient = authorityClient;
    this.idempotencyLedger = idempotencyLedger;
    this.inFlightCoalescer = inFlightCoalescer;
    this.canonicalHasher = canonicalHasher;
    this.actionVocabulary = actionVocabulary;
    this.dealCacheInvalidator = dealCacheInvalidator;
    this.localDealEventService = localDealEventService;
    this.objectMapper = objectMapper;
    this.bffMetrics = bffMetrics;
  }

  public ActionOutcome execute(ActionCommand command) {
    validate(command);
    final String eventType = actionVocabulary.requireEventType(command.actionType());
    final JsonNode payload = normalizePayload(command.payload());
    final IdempotencyKey key =
        new IdempotencyKey(
            command.dealId(),
            command.actionType(),
            command.actorId(),
            canonicalHasher.hash(payload));

    final Optional<ActionOutcome> stored = idempotencyLedger.get(key);
    if (stored.isPresent()) {
      logger.info("replaying stored action outcome key={}", key);
      bffMetrics.recordActionOutcome("replayed");
      return stored.get();
    }
    return inFlightCoalescer.run(
        key.coalescingKey(), () -> executeOnce(key, eventType, payload));
  }

  /** Explains an action without acting on it; no ledger or coalescing is involved. */
  public AuthorityExplanation explain(ActionCommand command) {
    validate(command);
    actionVocabulary.requireEventType(command.actionType());
    return explainWithFallback(
        command.dealId(),
        command.actionType(),
        command.actorId(),
        normalizePayload(command.payload()));
  }

  private ActionOutcome executeOnce(IdempotencyKey key, String eventType, JsonNode payload) {
    // coalescer へ入る前に別リクエストが確定・保存していた場合はそれを返す
    final Optional<ActionOutcome> stored = idempotencyLedger.get(key);
    if (stored.isPresent()) {
      bffMetrics.recordActionOutcome("replayed");
      return stored.get();
    }

    final AuthorityExplanation explanation;
    try {
      explanation =
          explainWithFallback(key.dealId(), key.actionType(), key.actorId(), payload);
    } catch (AuthorityIntegrationException ex) {
      throw surfaced(key, "explain", ex);
    }
    if (explanation.isBlocked()) {
      return storeBlocked(key, explanation.body());
    }

    final AuthorityAppendResult appended;
    try {
      appended = authorityClient.act(key.dealId(), eventType, key.actorId(), payload);
    } catch (AuthorityIntegrationException ex) {
      if (ex.isConflict() && ex.responseBody() != null) {
        // act 時点の 409 は authority が「現在は実行不可」と判断したもの
        return storeBlocked(key, ex.responseBody());
      }
      throw surfaced(key, "act", ex);
    }

    final ActionOutcome outcome =
        new ActionOutcome(
            ALLOWED_STATUS_CODE,
            objectMapper.valueToTree(ActionAllowedBody.of(key.actionType(), appended)),
            appended.eventId());
    idempotencyLedger.upsert(key, outcome);
    bffMetrics.recordActionOutcome("allowed");
    logger.info(
        "action committed key={} eventType={} appendedEventId={}",
        key,
        eventType,
        appended.eventId());
    afterCommit(key, eventType, appended.eventId());
    return outcome;
  }

  @VisibleForTesting
  AuthorityExplanation explainWithFallback(
      String dealId, String actionType, String actorId, JsonNode payload) {
    try {
      return authorityClient.explain(dealId, actionType, actorId, payload);
    } catch (AuthorityIntegrationException primary) {
      if (!primary.isUnknownAction()) {
        throw primary;
      }
      final String eventType = actionVocabulary.requireEventType(actionType);
      if (eventType.equals(actionType)) {
        throw primary;
      }
      logger.info(
          "authority does not know action, retrying explain dealId={} actionType={} eventType={}",
          dealId,
          actionType,
          eventType);
      try {
        return authorityClient.explain(dealId, eventType, actorId, payload);
      } catch (AuthorityIntegrationException fallback) {
        logger.warn(
            "explain fallback failed dealId={} actionType={} eventType={} reason={} status={}",
            dealId,
            actionType,
            eventType,
            fallback.reason(),
            fallback.statusCode());
        // 呼び出し元には最初の失敗を返し、フォールバック側の失敗は suppressed として残す
        primary.addSuppressed(fallback);
        throw primary;
      }
    }
  }

  private ActionOutcome storeBlocked(IdempotencyKey key, JsonNode explain) {
    final ActionOutcome outcome =
        new ActionOutcome(
            BLOCKED_STATUS_CODE,
            objectMapper.valueToTree(ActionBlockedBody.of(key.actionType(), explain)),
            null);
    idempotencyLedger.upsert(key, outcome);
    bffMetrics.recordActionOutcome("blocked");
    logger.info("action blocked by authority key={}", key);
    return outcome;
  }

  private AuthorityIntegrationException surfaced(
      IdempotencyKey key, String phase, AuthorityIntegrationException ex) {
    final String outcome = ex.isRetryable() ? "unavailable" : "failed";
    bffMetrics.recordActionOutcome(outcome);
    logger.warn(
        "action {} failed key={} dealId={} actionType={} reason={} status={} retryable={}",
        phase,
        key,
        key.dealId(),
        key.actionType(),
        ex.reason(),
        ex.statusCode(),
        ex.isRetryable());
    return ex;
  }

  private void afterCommit(IdempotencyKey key, String eventType, String appendedEventId) {
    // 台帳は書き込み済みのため、ここでの失敗は応答を変えずに記録だけ残す
    try {
      dealCacheInvalidator.invalidateDeal(key.dealId());
    } catch (RuntimeException ex) {
      logger.warn(
          "cache invalidation failed after commit key={} dealId={} actionType={}",
          key,
          key.dealId(),
          key.actionType(),
          ex);
    }
    try {
      final ObjectNode eventData = objectMapper.createObjectNode();
      eventData.put("actionType", key.actionType());
      eventData.put("eventType", eventType);
      eventData.put("appendedEventId", appendedEventId);
      eventData.put("idempotencyKey", key.value());
      localDealEventService.append(
          key.dealId(),
          LOCAL_EVENT_PREFIX + key.actionType().toUpperCase(Locale.ROOT),
          eventData,
          key.actorId());
    } catch (RuntimeException ex) {
      logger.error(
          "local audit append failed after commit key={} dealId={} actionType={}",
          key,
          key.dealId(),
          key.actionType(),
          ex);
    }
  }

  private void validate(ActionCommand command) {
    if (command == null) {
      throw new ActionValidationException("action request is required");
    }
    if (isBlank(command.dealId())) {
      throw new ActionValidationException("dealId is required");
    }
    if (isBlank(command.actionType())) {
      throw new ActionValidationException("actionType is required");
    }
    if (isBlank(command.actorId())) {
      throw new ActionValidationException("actorId is required");
    }
    if (!actionVocabulary.isKnown(command.actionType())) {
      throw new ActionValidationException("Unsupported action type: " + command.actionType());
    }
  }

  private JsonNode normalizePayload(JsonNode payload) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      return objectMapper.createObjectNode();
    }
    if (!payload.isObject()) {
      throw new ActionValidationException("payload must be a JSON object");
    }
    return payload;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
