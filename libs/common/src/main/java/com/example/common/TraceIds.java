package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_TRACE_ID = "trace_id";
  private static final String MDC_LEGACY_TRACE_ID = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the trace id bound to the current thread, or a fresh one when none is bound. */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_TRACE_ID);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get(MDC_LEGACY_TRACE_ID);
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
