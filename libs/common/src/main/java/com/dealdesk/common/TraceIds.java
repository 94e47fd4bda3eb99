package com.dealdesk.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
