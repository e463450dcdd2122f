package com.example.dyndns_proxy.service.dto;

public record CloudflareApiError(Integer code, String message) {}
