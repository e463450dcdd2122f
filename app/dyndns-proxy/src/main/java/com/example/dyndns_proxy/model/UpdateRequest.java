package com.example.dyndns_proxy.model;

/**
 * 役割:
 * - DynDNS 更新リクエスト 1 件分の入力を保持する。
 *
 * 期待動作:
 * - hostname は必須。空なら外部呼び出し前に notfqdn とする。
 * - requestedAddress(myip)が空のときだけ observedAddress(呼び出し元 IP)を採用する。
 */
public record UpdateRequest(String hostname, String requestedAddress, String observedAddress) {

  public boolean hasRequestedAddress() {
    return requestedAddress != null && !requestedAddress.isEmpty();
  }

  public String targetAddress() {
    return hasRequestedAddress() ? requestedAddress : observedAddress;
  }
}
