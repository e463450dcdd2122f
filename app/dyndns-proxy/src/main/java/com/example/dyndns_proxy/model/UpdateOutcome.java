package com.example.dyndns_proxy.model;

/**
 * 役割:
 * - 更新リクエスト 1 件の結果(DynDNS 応答トークンと HTTP ステータス)を表す。
 *
 * 前提:
 * - address を持つのは {@link DynDnsResponseCode#GOOD} と {@link DynDnsResponseCode#NOCHG} だけ。
 */
public record UpdateOutcome(DynDnsResponseCode code, String address) {

  public static UpdateOutcome updated(String address) {
    return new UpdateOutcome(DynDnsResponseCode.GOOD, address);
  }

  public static UpdateOutcome noChange(String address) {
    return new UpdateOutcome(DynDnsResponseCode.NOCHG, address);
  }

  public static UpdateOutcome rejected(DynDnsResponseCode reason) {
    if (reason != DynDnsResponseCode.BADAUTH
        && reason != DynDnsResponseCode.NOTFQDN
        && reason != DynDnsResponseCode.BADIP) {
      throw new IllegalArgumentException("not a rejection code: " + reason);
    }
    return new UpdateOutcome(reason, null);
  }

  public static UpdateOutcome remoteFailure() {
    return new UpdateOutcome(DynDnsResponseCode.DNSERR, null);
  }

  public int httpStatus() {
    return code.httpStatus();
  }

  /** 1 行の DynDNS 応答本文。例: {@code good 1.2.3.4}、{@code badip}。 */
  public String responseBody() {
    return address == null ? code.token() : code.token() + " " + address;
  }
}
