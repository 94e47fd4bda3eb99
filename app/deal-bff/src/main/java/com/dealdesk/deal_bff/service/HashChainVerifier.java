/*
 * どこで: Deal-BFF サービス層
 * 何を: 1 つの出所の監査イベント列について連番と previousHash の連結を検証する
 * なぜ: 欠番や改ざんを検出し、運用者が確認できる形で全件報告するため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.deal_bff.model.AuditEvent;
import com.dealdesk.deal_bff.model.ChainIssue;
import com.dealdesk.deal_bff.model.ChainVerification;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class HashChainVerifier {

  private static final Comparator<AuditEvent> BY_SEQUENCE =
      Comparator.comparing(
          AuditEvent::sequenceNumber, Comparator.nullsLast(Comparator.naturalOrder()));

  /**
   * Walks the events in sequence order. The first event must carry sequence 1 and no previous
   * hash; every later event must carry the next sequence and the prior event's hash. All
   * mismatches are reported, the walk does not stop at the first one.
   */
  public ChainVerification verifyChain(List<AuditEvent> events) {
    final List<AuditEvent> ordered = new ArrayList<>(events);
    ordered.sort(BY_SEQUENCE);

    final List<ChainIssue> issues = new ArrayList<>();
    long expectedSequence = 1;
    String expectedPreviousHash = null;
    for (AuditEvent event : ordered) {
      final Long sequence = event.sequenceNumber();
      if (sequence == null || sequence != expectedSequence) {
        issues.add(ChainIssue.sequenceGap(expectedSequence, sequence, event.id()));
      }
      if (!Objects.equals(event.previousHash(), expectedPreviousHash)) {
        issues.add(ChainIssue.chainBreak(sequence, event.id()));
      }
      // 欠番の後も以降のイベントを続けて検証できるよう、実際の連番を基準に進める
      expectedSequence = (sequence == null ? expectedSequence : sequence) + 1;
      expectedPreviousHash = event.hash();
    }
    return new ChainVerification(issues.isEmpty(), ordered.size(), issues);
  }
}
