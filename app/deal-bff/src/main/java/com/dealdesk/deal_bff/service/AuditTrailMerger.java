/*
 * どこで: Deal-BFF サービス層
 * 何を: ローカルと authority の監査イベントを出所タグ付きで 1 本のタイムラインへ並べる
 * なぜ: 利用者が 2 つの監査ログを発生時刻順にまとめて確認できるようにするため
 */
package com.dealdesk.deal_bff.service;

import com.dealdesk.deal_bff.model.AuditEvent;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class AuditTrailMerger {

  static final Comparator<AuditEvent> MOST_RECENT_FIRST =
      Comparator.comparing(
          AuditEvent::occurredAt, Comparator.nullsLast(Comparator.reverseOrder()));

  /**
   * Interleaves both streams by occurrence time, most recent first. No deduplication is done and
   * the input lists are left untouched.
   */
  public List<AuditEvent> merge(List<AuditEvent> localEvents, List<AuditEvent> authorityEvents) {
    final List<AuditEvent> timeline = new ArrayList<>(localEvents.size() + authorityEvents.size());
    timeline.addAll(localEvents);
    timeline.addAll(authorityEvents);
    timeline.sort(MOST_RECENT_FIRST);
    return List.copyOf(timeline);
  }
}
