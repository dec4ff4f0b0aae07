package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void currentOrNewReusesMdcTraceId() {
    MDC.put(TraceIds.MDC_KEY, "trace-1");

    assertThat(TraceIds.currentOrNew()).isEqualTo("trace-1");
  }

  @Test
  void currentOrNewFallsBackToLegacyKey() {
    MDC.put("traceId", "legacy-1");

    assertThat(TraceIds.currentOrNew()).isEqualTo("legacy-1");
  }

  @Test
  void currentOrNewCreatesFreshIdWhenBlank() {
    MDC.put(TraceIds.MDC_KEY, " ");

    final String traceId = TraceIds.currentOrNew();

    assertThat(traceId).isNotBlank().isNotEqualTo(TraceIds.currentOrNew());
  }
}
