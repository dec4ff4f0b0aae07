/*
 * Where: Common utilities
 * What: Creates and resolves trace ids carried across async hand-offs
 * Why: Keep one trace id from the request thread through to the worker thread
 */
package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";
  private static final String LEGACY_MDC_KEY = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the trace id of the current thread's MDC, or a fresh one when none is set. */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get(LEGACY_MDC_KEY);
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
