package com.dealdesk.deal_bff.model;

import java.util.List;

/**
 * Authority section of a verification report: the locally recomputed walk over the authority's
 * events combined with the authority's own self-check.
 */
public record AuthorityChainVerification(
    boolean valid, int eventCount, List<ChainIssue> issues, Integer totalEvents) {

  public AuthorityChainVerification {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
