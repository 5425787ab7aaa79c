package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String currentOrNew() {
    final String current = MDC.get(MDC_KEY);
    if (current != null && !current.isBlank()) {
      return current;
    }
    return newTraceId();
  }
}
