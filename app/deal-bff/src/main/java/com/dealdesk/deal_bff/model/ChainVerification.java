package com.dealdesk.deal_bff.model;

import java.util.List;

public record ChainVerification(boolean valid, int eventCount, List<ChainIssue> issues) {

  public ChainVerification {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
