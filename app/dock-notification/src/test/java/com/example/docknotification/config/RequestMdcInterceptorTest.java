package com.example.docknotification.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.TraceIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void traceHeaderIsCarriedForTheRequestOnly() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/debug/notification-queues");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Trace-Id", " trace-1 ");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("trace-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/debug/notification-queues");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
  }

  @Test
  void requestIdDoublesAsTraceIdWhenNoTraceHeader() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo(MDC.get("request_id"));
  }
}
