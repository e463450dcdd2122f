package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 受け取った id が空でなければ前後空白を除いて使い、空なら新しい id を採番する。 */
  public static String orNewTraceId(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate.trim();
  }
}
