/*
 * どこで: DynDNS プロキシのサービス層
 * 何を: myip 省略時に呼び出し元の IP を推定する
 * なぜ: リバースプロキシ越しでも DynDNS クライアントの実 IP を登録するため
 */
package com.example.dyndns_proxy.service;

import com.example.common.http.ForwardedAddresses;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

@Component
public class ClientAddressResolver {

  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  static final String REAL_IP_HEADER = "X-Real-IP";

  /**
   * 役割:
   * - X-Forwarded-For の先頭、X-Real-IP、接続元アドレス(ポート除去)の順に採用する。
   *
   * 期待動作:
   * - ヘッダーは空文字でなければ採用し、前後空白を除く。
   * - 空白だけのヘッダーは空文字を返し、後段で badip にする。
   */
  public String resolve(HttpServletRequest request) {
    final String forwarded =
        ForwardedAddresses.firstForwardedFor(request.getHeader(FORWARDED_FOR_HEADER));
    if (forwarded != null) {
      return forwarded;
    }
    final String realIp = request.getHeader(REAL_IP_HEADER);
    if (realIp != null && !realIp.isEmpty()) {
      return realIp.trim();
    }
    return ForwardedAddresses.stripPort(request.getRemoteAddr());
  }
}
