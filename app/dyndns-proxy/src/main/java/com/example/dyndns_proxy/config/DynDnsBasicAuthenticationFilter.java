/*
 * どこで: DynDNS プロキシのセキュリティ設定
 * 何を: /nic/update の Basic 認証を設定値との完全一致で検証し、不一致なら badauth を返す
 * なぜ: 認証失敗時に DynDNS の応答トークンを返し、プロバイダ呼び出しに到達させないため
 */
package com.example.dyndns_proxy.config;

import com.example.dyndns_proxy.api.DynDnsResponses;
import com.example.dyndns_proxy.model.DynDnsResponseCode;
import com.example.dyndns_proxy.service.DynDnsMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class DynDnsBasicAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(DynDnsBasicAuthenticationFilter.class);
  private static final String BASIC_PREFIX = "Basic ";

  static final String UPDATE_PATH = "/nic/update";
  static final String CLIENT_ROLE = "ROLE_DYNDNS_CLIENT";

  private final DynDnsAuthProperties properties;
  private final DynDnsMetrics dynDnsMetrics;

  public DynDnsBasicAuthenticationFilter(
      DynDnsAuthProperties properties, DynDnsMetrics dynDnsMetrics) {
    this.properties = properties;
    this.dynDnsMetrics = dynDnsMetrics;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.enabled() || !UPDATE_PATH.equals(request.getRequestURI());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String username = authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (username == null) {
      logger.warn("dyndns update rejected: bad credentials from remote={}", request.getRemoteAddr());
      dynDnsMetrics.recordUpdateResult(DynDnsResponseCode.BADAUTH.token());
      writeBadAuth(response);
      return;
    }
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                username, "N/A", List.of(new SimpleGrantedAuthority(CLIENT_ROLE))));
    filterChain.doFilter(request, response);
  }

  /** 認証成功時はユーザー名、失敗時は null を返す。 */
  private String authenticate(String authorization) {
    if (authorization == null || !authorization.startsWith(BASIC_PREFIX)) {
      return null;
    }
    final String credentials = decode(authorization.substring(BASIC_PREFIX.length()));
    if (credentials == null) {
      return null;
    }
    final int separator = credentials.indexOf(':');
    if (separator < 0) {
      return null;
    }
    final String username = credentials.substring(0, separator);
    final String password = credentials.substring(separator + 1);
    if (matches(username, properties.username()) && matches(password, properties.password())) {
      return username;
    }
    return null;
  }

  private String decode(String encoded) {
    try {
      return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      logger.debug("authorization header is not valid base64");
      return null;
    }
  }

  private boolean matches(String actual, String expected) {
    return MessageDigest.isEqual(
        actual.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }

  private void writeBadAuth(HttpServletResponse response) throws IOException {
    response.setStatus(DynDnsResponseCode.BADAUTH.httpStatus());
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, DynDnsResponses.BASIC_CHALLENGE);
    response.setContentType(MediaType.TEXT_PLAIN_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.getWriter().write(DynDnsResponseCode.BADAUTH.token());
  }
}
