package com.dealdesk.deal_bff.service;

/** Cache key layout: every entry describing a deal lives under {@code deal:{dealId}:}. */
public final class DealCacheKeys {

  private DealCacheKeys() {}

  public static String dealPrefix(String dealId) {
    return "deal:" + dealId + ":";
  }

  public static String snapshot(String dealId) {
    return dealPrefix(dealId) + "snapshot";
  }

  public static String authorityEvents(String dealId) {
    return dealPrefix(dealId) + "events";
  }
}
