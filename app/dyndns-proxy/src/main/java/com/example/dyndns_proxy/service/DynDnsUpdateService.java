/*
 * どこで: DynDNS プロキシのサービス層
 * 何を: 入力検証 → 現在レコード取得 → 差分判定 → 条件付き更新を行い DynDNS 応答を決める
 * なぜ: 1 リクエストあたり取得 1 回・更新高々 1 回で Cloudflare のレコードを同期するため
 */
package com.example.dyndns_proxy.service;

import com.example.dyndns_proxy.model.AddressRecordType;
import com.example.dyndns_proxy.model.DynDnsResponseCode;
import com.example.dyndns_proxy.model.RemoteRecord;
import com.example.dyndns_proxy.model.UpdateOutcome;
import com.example.dyndns_proxy.model.UpdateRequest;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DynDnsUpdateService {

  private static final Logger logger = LoggerFactory.getLogger(DynDnsUpdateService.class);

  private final DnsProviderClient dnsProviderClient;
  private final DynDnsMetrics dynDnsMetrics;

  public UpdateOutcome update(UpdateRequest request) {
    final UpdateOutcome outcome = reconcile(request);
    dynDnsMetrics.recordUpdateResult(outcome.code().token());
    return outcome;
  }

  private UpdateOutcome reconcile(UpdateRequest request) {
    if (request.hostname() == null || request.hostname().isEmpty()) {
      return UpdateOutcome.rejected(DynDnsResponseCode.NOTFQDN);
    }
    final String hostname = request.hostname();
    final String address = request.targetAddress();
    if (!IpAddressSyntax.isValid(address)) {
      logger.info("rejecting update for hostname={}: invalid address={}", hostname, address);
      return UpdateOutcome.rejected(DynDnsResponseCode.BADIP);
    }

    logger.info(
        "Updating DNS record: hostname={}, ip={}, source={}",
        hostname,
        address,
        request.hasRequestedAddress() ? "myip" : "client");

    final RemoteRecord current;
    Timer.Sample sample = dynDnsMetrics.startProviderCall();
    try {
      current = dnsProviderClient.fetchRecord(hostname, AddressRecordType.forAddress(address));
      dynDnsMetrics.recordProviderCall(sample, "fetch", "success");
    } catch (DnsProviderException ex) {
      dynDnsMetrics.recordProviderCall(sample, "fetch", ex.reason().name());
      logger.warn(
          "Error getting DNS record: hostname={} reason={} message={}",
          hostname,
          ex.reason(),
          ex.getMessage());
      return UpdateOutcome.remoteFailure();
    }

    if (address.equals(current.address())) {
      logger.info("DNS record unchanged: hostname={}, ip={}", hostname, address);
      return UpdateOutcome.noChange(address);
    }

    sample = dynDnsMetrics.startProviderCall();
    try {
      dnsProviderClient.updateRecord(current.id(), hostname, address);
      dynDnsMetrics.recordProviderCall(sample, "update", "success");
    } catch (DnsProviderException ex) {
      dynDnsMetrics.recordProviderCall(sample, "update", ex.reason().name());
      logger.warn(
          "Error updating DNS record: hostname={} recordId={} reason={} message={}",
          hostname,
          current.id(),
          ex.reason(),
          ex.getMessage());
      return UpdateOutcome.remoteFailure();
    }

    logger.info(
        "DNS record updated: hostname={}, ip={}, previous={}",
        hostname,
        address,
        current.address());
    return UpdateOutcome.updated(address);
  }
}
