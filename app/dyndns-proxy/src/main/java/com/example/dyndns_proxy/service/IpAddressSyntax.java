package com.example.dyndns_proxy.service;

/**
 * 役割:
 * - badip 判定に使うアドレスの構文チェック。
 *
 * 期待動作:
 * - ドット区切りで空でない 4 セグメントなら受理する(数値範囲は見ない)。
 * - それ以外はコロンを含む文字列だけを受理する。既存クライアントがこの判定に依存している。
 */
public final class IpAddressSyntax {

  private IpAddressSyntax() {}

  public static boolean isValid(String address) {
    if (address == null) {
      return false;
    }
    final String[] segments = address.split("\\.", -1);
    if (segments.length == 4) {
      for (String segment : segments) {
        if (segment.isEmpty()) {
          return false;
        }
      }
      return true;
    }
    return address.contains(":");
  }
}
