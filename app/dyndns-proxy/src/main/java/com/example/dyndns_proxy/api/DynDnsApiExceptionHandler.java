/*
 * どこで: DynDNS プロキシ API
 * 何を: 更新処理から漏れた想定外の例外を 911 応答へ変換する
 * なぜ: スタックトレースや内部エラー文言を DynDNS クライアントへ返さないため
 */
package com.example.dyndns_proxy.api;

import com.example.dyndns_proxy.model.UpdateOutcome;
import com.example.dyndns_proxy.service.DynDnsMetrics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = DynDnsUpdateController.class)
@RequiredArgsConstructor
public class DynDnsApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(DynDnsApiExceptionHandler.class);

  private final DynDnsMetrics dynDnsMetrics;

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<String> handleUnexpected(RuntimeException ex) {
    logger.error("dyndns update failed unexpectedly", ex);
    final UpdateOutcome outcome = UpdateOutcome.remoteFailure();
    dynDnsMetrics.recordUpdateResult(outcome.code().token());
    return DynDnsResponses.of(outcome);
  }
}
