/*
 * どこで: DynDNS プロキシのドメインモデル
 * 何を: DynDNS 応答トークンと HTTP ステータスの対応を定義する
 * なぜ: 応答本文とステータスの組み合わせを一箇所で固定するため
 */
package com.example.dyndns_proxy.model;

public enum DynDnsResponseCode {
  GOOD("good", 200),
  NOCHG("nochg", 200),
  BADAUTH("badauth", 401),
  NOTFQDN("notfqdn", 400),
  BADIP("badip", 400),
  DNSERR("911", 500);

  private final String token;
  private final int httpStatus;

  DynDnsResponseCode(String token, int httpStatus) {
    this.token = token;
    this.httpStatus = httpStatus;
  }

  public String token() {
    return token;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
