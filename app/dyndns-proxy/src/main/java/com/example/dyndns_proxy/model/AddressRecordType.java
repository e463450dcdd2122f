package com.example.dyndns_proxy.model;

/**
 * 役割:
 * - 更新対象アドレスの種別(IPv4 なら A、IPv6 なら AAAA)を表す。
 *
 * 前提:
 * - 構文検証を通過したアドレスだけを受け取る。コロンを含めば IPv6 とみなす。
 */
public enum AddressRecordType {
  A,
  AAAA;

  public static AddressRecordType forAddress(String address) {
    return address.contains(":") ? AAAA : A;
  }
}
