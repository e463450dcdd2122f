package com.example.dyndns_proxy.service.dto;

/** {@code PUT /zones/{zoneId}/dns_records/{recordId}} の本文。ttl=1 は自動を表す。 */
public record CloudflareRecordUpdateRequest(
    String type, String name, String content, int ttl, boolean proxied) {}
