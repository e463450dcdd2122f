/*
 * どこで: DynDNS プロキシ下流 DTO
 * 何を: Cloudflare の DNS レコード表現のうち利用する項目を保持する
 * なぜ: 下流スキーマ差分をサービス層へ伝播させないため
 */
package com.example.dyndns_proxy.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CloudflareDnsRecord(
    String id,
    String type,
    String name,
    String content,
    Integer ttl,
    Boolean proxied,
    String modifiedOn) {}
