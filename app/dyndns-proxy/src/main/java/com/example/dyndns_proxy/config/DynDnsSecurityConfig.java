package com.example.dyndns_proxy.config;

import com.example.dyndns_proxy.service.DynDnsMetrics;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableConfigurationProperties(DynDnsAuthProperties.class)
public class DynDnsSecurityConfig {

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, DynDnsAuthProperties properties, DynDnsMetrics dynDnsMetrics)
      throws Exception {
    // servlet filter として自動登録させないため Bean にはしない。
    final DynDnsBasicAuthenticationFilter basicAuthenticationFilter =
        new DynDnsBasicAuthenticationFilter(properties, dynDnsMetrics);
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(basicAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth -> {
              auth.requestMatchers(
                      "/health",
                      "/error",
                      "/actuator/health",
                      "/actuator/health/**",
                      "/actuator/info",
                      "/actuator/prometheus")
                  .permitAll();
              if (properties.enabled()) {
                auth.requestMatchers(HttpMethod.GET, DynDnsBasicAuthenticationFilter.UPDATE_PATH)
                    .hasAuthority(DynDnsBasicAuthenticationFilter.CLIENT_ROLE);
              } else {
                auth.requestMatchers(HttpMethod.GET, DynDnsBasicAuthenticationFilter.UPDATE_PATH)
                    .permitAll();
              }
              auth.anyRequest().denyAll();
            })
        .exceptionHandling(
            ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)));
    return http.build();
  }
}
