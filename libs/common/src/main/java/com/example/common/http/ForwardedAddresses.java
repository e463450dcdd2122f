/*
 * どこで: Common HTTP ヘルパー
 * 何を: X-Forwarded-For / 接続元アドレスから送信元 IP を取り出す
 * なぜ: MDC とアドレス推定で同じ解釈を共有するため
 */
package com.example.common.http;

public final class ForwardedAddresses {

  private ForwardedAddresses() {}

  /**
   * 役割:
   * - X-Forwarded-For 形式の一覧から先頭要素を前後空白を除いて返す。
   *
   * 期待動作:
   * - ヘッダーが無い(null)か空文字なら null を返す。
   * - 空白だけのヘッダーはヘッダーありとして扱い、空文字を返す。呼び出し側で badip 等に落とす。
   */
  public static String firstForwardedFor(String headerValue) {
    if (headerValue == null || headerValue.isEmpty()) {
      return null;
    }
    final int commaIndex = headerValue.indexOf(',');
    if (commaIndex < 0) {
      return headerValue.trim();
    }
    return headerValue.substring(0, commaIndex).trim();
  }

  /**
   * 役割:
   * - 接続元アドレスからポートを取り除く。
   *
   * 期待動作:
   * - {@code 192.168.1.1:12345} は {@code 192.168.1.1}、{@code [2001:db8::1]:443} は
   *   {@code 2001:db8::1} にする。
   * - 角括弧なしでコロンが複数ある IPv6 リテラルはポートを持たないため、そのまま返す。
   */
  public static String stripPort(String peerAddress) {
    if (peerAddress == null) {
      return null;
    }
    final String address = peerAddress.trim();
    if (address.startsWith("[")) {
      final int closing = address.indexOf(']');
      return closing < 0 ? address : address.substring(1, closing);
    }
    final int firstColon = address.indexOf(':');
    if (firstColon < 0 || firstColon != address.lastIndexOf(':')) {
      return address;
    }
    return address.substring(0, firstColon);
  }
}
