/*
 * どこで: DynDNS プロキシ設定
 * 何を: Cloudflare API 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl/Bearer トークン/タイムアウトを呼び出し側から切り離すため
 */
package com.example.dyndns_proxy.config;

import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(CloudflareClientProperties.class)
public class CloudflareClientConfig {

  @Bean
  RestClient cloudflareRestClient(
      RestClient.Builder builder, CloudflareClientProperties properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.timeout()).build();
    // 接続から本文受信完了までを 1 呼び出しとして timeout 内に収める。
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(new DeadlineClientHttpRequestFactory(httpClient, properties.timeout()))
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
