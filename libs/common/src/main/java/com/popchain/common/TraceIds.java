package com.popchain.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 空のトレース ID は新規採番に置き換える。 */
  public static String resolve(String traceId) {
    if (traceId == null || traceId.isBlank()) {
      return newTraceId();
    }
    return traceId;
  }
}
