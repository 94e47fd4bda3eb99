package com.dealdesk.deal_bff.model;

public enum AuditSourceFilter {
  ALL,
  LOCAL,
  AUTHORITY;

  public boolean includes(AuditSource source) {
    return this == ALL || name().equals(source.name());
  }
}
