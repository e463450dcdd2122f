package com.example.dyndns_proxy.service.dto;

import java.util.List;

/** 単一レコード操作の Cloudflare 応答エンベロープ。 */
public record CloudflareRecordResponse(
    boolean success,
    List<CloudflareApiError> errors,
    List<CloudflareApiError> messages,
    CloudflareDnsRecord result) {}
