/*
 * どこで: DynDNS プロキシの Web 設定
 * 何を: request_id / client_ip / hostname などをリクエスト単位で MDC に載せ、完了後に外す
 * なぜ: Security フィルタが出す badauth ログも含め、1 リクエストのログを相関できるようにするため
 */
package com.example.dyndns_proxy.config;

import com.example.common.TraceIds;
import com.example.common.http.ForwardedAddresses;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(RequestMdcFilter.ORDER)
public class RequestMdcFilter extends OncePerRequestFilter {

  // Spring Security のフィルタチェーンより前に実行する。
  static final int ORDER = SecurityProperties.DEFAULT_FILTER_ORDER - 10;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", TraceIds.orNewTraceId(request.getHeader("X-Request-Id")));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    put(keys, "hostname", request.getParameter("hostname"));
    try {
      filterChain.doFilter(request, response);
    } finally {
      keys.forEach(MDC::remove);
    }
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded =
        ForwardedAddresses.firstForwardedFor(request.getHeader("X-Forwarded-For"));
    return forwarded != null && !forwarded.isEmpty() ? forwarded : request.getRemoteAddr();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
