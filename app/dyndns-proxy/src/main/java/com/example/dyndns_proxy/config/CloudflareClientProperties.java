/*
 * どこで: DynDNS プロキシ設定
 * 何を: Cloudflare API 呼び出し設定(認証トークン/ゾーン/URL/タイムアウト)を保持する
 * なぜ: 必須の認証情報が欠けた状態で起動しないよう、起動時に検証するため
 */
package com.example.dyndns_proxy.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cloudflare")
@Validated
public record CloudflareClientProperties(
    @NotBlank String apiToken,
    @NotBlank String zoneId,
    String baseUrl,
    String listRecordsPath,
    String updateRecordPath,
    Duration timeout) {

  public CloudflareClientProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank() ? "https://api.cloudflare.com/client/v4" : baseUrl;
    listRecordsPath =
        listRecordsPath == null || listRecordsPath.isBlank()
            ? "/zones/{zoneId}/dns_records?type={type}&name={name}"
            : listRecordsPath;
    updateRecordPath =
        updateRecordPath == null || updateRecordPath.isBlank()
            ? "/zones/{zoneId}/dns_records/{recordId}"
            : updateRecordPath;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
  }

  @AssertTrue(message = "cloudflare.timeout must be positive")
  public boolean isTimeoutPositive() {
    return timeout != null && !timeout.isZero() && !timeout.isNegative();
  }
}
