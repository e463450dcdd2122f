package com.example.dyndns_proxy.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.FilterChain;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putsMdcValuesDuringChainAndRemovesThemAfterwards() throws Exception {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/nic/update");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addParameter("hostname", "home.example.com");
    final Map<String, String> seen = new HashMap<>();

    filter.doFilter(request, new MockHttpServletResponse(), capturing(seen));

    assertThat(seen)
        .containsEntry("request_id", "req-1")
        .containsEntry("http_method", "GET")
        .containsEntry("http_path", "/nic/update")
        .containsEntry("client_ip", "10.0.0.1")
        .containsEntry("hostname", "home.example.com");
    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("hostname")).isNull();
  }

  @Test
  void generatesRequestIdAndUsesPeerAddressWhenHeadersMissing() throws Exception {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
    request.setRemoteAddr("192.168.1.1");
    final Map<String, String> seen = new HashMap<>();

    filter.doFilter(request, new MockHttpServletResponse(), capturing(seen));

    assertThat(seen.get("request_id")).isNotBlank();
    assertThat(seen).containsEntry("client_ip", "192.168.1.1").doesNotContainKey("hostname");
  }

  @Test
  void usesPeerAddressForClientIpWhenForwardedForIsWhitespaceOnly() throws Exception {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/nic/update");
    request.addHeader("X-Forwarded-For", "   ");
    request.setRemoteAddr("192.168.1.1");
    final Map<String, String> seen = new HashMap<>();

    filter.doFilter(request, new MockHttpServletResponse(), capturing(seen));

    assertThat(seen).containsEntry("client_ip", "192.168.1.1");
  }

  @Test
  void removesMdcValuesWhenChainFails() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/nic/update");
    final FilterChain failing =
        (req, res) -> {
          throw new IllegalStateException("boom");
        };

    assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), failing))
        .isInstanceOf(IllegalStateException.class);
    assertThat(MDC.get("request_id")).isNull();
  }

  private FilterChain capturing(Map<String, String> seen) {
    return (req, res) -> seen.putAll(MDC.getCopyOfContextMap());
  }
}
