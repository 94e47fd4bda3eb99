package com.dealdesk.deal_bff.model;

public enum AuditSource {
  LOCAL,
  AUTHORITY
}
