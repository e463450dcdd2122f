/*
 * どこで: DynDNS プロキシのサービス層
 * 何を: DNS プロバイダ呼び出し失敗を理由付きで表現する
 * なぜ: 取得/更新の失敗をハンドラで一律 911 に変換し、理由はログとメトリクスに残すため
 */
package com.example.dyndns_proxy.service;

public class DnsProviderException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    UNAUTHORIZED,
    REJECTED,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public DnsProviderException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DnsProviderException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
