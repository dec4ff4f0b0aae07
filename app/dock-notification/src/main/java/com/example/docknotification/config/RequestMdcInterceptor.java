/*
 * Where: Dock notification web layer
 * What: Puts request and trace identifiers into the MDC for the duration of a request
 * Why: Jobs enqueued while handling a request carry the request's trace id to the worker
 */
package com.example.docknotification.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String TRACE_HEADER = "X-Trace-Id";
  static final String REQUEST_HEADER = "X-Request-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = headerOrNew(request, REQUEST_HEADER);
    put(keys, "request_id", requestId);
    put(keys, TraceIds.MDC_KEY, headerOr(request, TRACE_HEADER, requestId));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String headerOrNew(HttpServletRequest request, String header) {
    return headerOr(request, header, UUID.randomUUID().toString());
  }

  private String headerOr(HttpServletRequest request, String header, String fallback) {
    final String value = request.getHeader(header);
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return fallback;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
