package com.example.dyndns_proxy.service.dto;

import java.util.List;

/** {@code GET /zones/{zoneId}/dns_records} の Cloudflare 応答エンベロープ。 */
public record CloudflareRecordListResponse(
    boolean success,
    List<CloudflareApiError> errors,
    List<CloudflareApiError> messages,
    List<CloudflareDnsRecord> result) {}
