/*
 * どこで: Deal-BFF サービス層
 * 何を: アクション種別から authority のイベント種別への有限対応表を保持する
 * なぜ: 旧語彙アクションのフォールバック先を文字列推測でなく明示表で決めるため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.deal_bff.config.ActionVocabularyProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Finite action-type to event-type lookup table.
 *
 * <p>The built-in entries cover the deal lifecycle; {@code bff.actions.event-types} can add or
 * override entries. An action type absent from the table is rejected before any downstream call.
 */
@Component
public class ActionVocabulary {

  static final Map<String, String> DEFAULT_EVENT_TYPES = defaultEventTypes();

  private final Map<String, String> eventTypes;

  public ActionVocabulary(ActionVocabularyProperties properties) {
    final Map<String, String> merged = new LinkedHashMap<>(DEFAULT_EVENT_TYPES);
    merged.putAll(properties.eventTypes());
    this.eventTypes = Collections.unmodifiableMap(merged);
  }

  public boolean isKnown(String actionType) {
    return actionType != null && eventTypes.containsKey(actionType);
  }

  public Optional<String> eventTypeFor(String actionType) {
    return Optional.ofNullable(actionType).map(eventTypes::get);
  }

  public String requireEventType(String actionType) {
    return eventTypeFor(actionType)
        .orElseThrow(
            () -> new ActionValidationException("Unsupported action type: " + actionType));
  }

  public Set<String> actionTypes() {
    return eventTypes.keySet();
  }

  private static Map<String, String> defaultEventTypes() {
    final Map<String, String> table = new LinkedHashMap<>();
    table.put("OPEN_REVIEW", "ReviewOpened");
    table.put("APPROVE_DEAL", "DealApproved");
    table.put("ATTEST_READY_TO_CLOSE", "ClosingReadinessAttested");
    table.put("FINALIZE_CLOSING", "ClosingFinalized");
    table.put("ACTIVATE_OPERATIONS", "OperationsActivated");
    table.put("DECLARE_CHANGE", "MaterialChangeDetected");
    table.put("RECONCILE_CHANGE", "ChangeReconciled");
    table.put("DECLARE_DISTRESS", "DistressDeclared");
    table.put("RESOLVE_DISTRESS", "DistressResolved");
    table.put("IMPOSE_FREEZE", "FreezeImposed");
    table.put("LIFT_FREEZE", "FreezeLifted");
    table.put("FINALIZE_EXIT", "ExitFinalized");
    table.put("TERMINATE_DEAL", "DealTerminated");
    table.put("DISPUTE_DATA", "DataDisputed");
    table.put("OVERRIDE", "OverrideAttested");
    return Collections.unmodifiableMap(table);
  }
}
