package com.example.dyndns_proxy.api;

import com.example.dyndns_proxy.model.DynDnsResponseCode;
import com.example.dyndns_proxy.model.UpdateOutcome;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/** 更新結果を 1 行の text/plain DynDNS 応答へ変換する。 */
public final class DynDnsResponses {

  public static final String BASIC_CHALLENGE = "Basic realm=\"DynDNS\"";

  private DynDnsResponses() {}

  public static ResponseEntity<String> of(UpdateOutcome outcome) {
    final ResponseEntity.BodyBuilder builder =
        ResponseEntity.status(outcome.httpStatus()).contentType(MediaType.TEXT_PLAIN);
    if (outcome.code() == DynDnsResponseCode.BADAUTH) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, BASIC_CHALLENGE);
    }
    return builder.body(outcome.responseBody());
  }
}
