/*
 * どこで: DynDNS プロキシのサービス層
 * 何を: Cloudflare DNS API でレコードの取得と内容の置き換えを行う
 * なぜ: 下流 API の URL/エンベロープ/失敗種別をハンドラから隠すため
 */
package com.example.dyndns_proxy.service;

import com.example.dyndns_proxy.config.CloudflareClientProperties;
import com.example.dyndns_proxy.model.AddressRecordType;
import com.example.dyndns_proxy.model.RemoteRecord;
import com.example.dyndns_proxy.service.dto.CloudflareApiError;
import com.example.dyndns_proxy.service.dto.CloudflareDnsRecord;
import com.example.dyndns_proxy.service.dto.CloudflareRecordListResponse;
import com.example.dyndns_proxy.service.dto.CloudflareRecordResponse;
import com.example.dyndns_proxy.service.dto.CloudflareRecordUpdateRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class CloudflareDnsClient implements DnsProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(CloudflareDnsClient.class);

  static final int AUTOMATIC_TTL = 1;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient cloudflareRestClient;

  private final CloudflareClientProperties properties;

  public CloudflareDnsClient(
      RestClient cloudflareRestClient, CloudflareClientProperties properties) {
    this.cloudflareRestClient = cloudflareRestClient;
    this.properties = properties;
  }

  @Override
  public RemoteRecord fetchRecord(String hostname, AddressRecordType type) {
    validateHostname(hostname);
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }
    final CloudflareRecordListResponse response;
    try {
      response =
          cloudflareRestClient
              .get()
              .uri(
                  properties.listRecordsPath(),
                  Map.of("zoneId", properties.zoneId(), "type", type.name(), "name", hostname))
              .retrieve()
              .body(CloudflareRecordListResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "fetchRecord");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "fetchRecord");
    } catch (RuntimeException ex) {
      throw mapUnexpectedException(ex, "fetchRecord");
    }
    return toRemoteRecord(requireListResponse(response, hostname, type));
  }

  @Override
  public void updateRecord(String recordId, String hostname, String address) {
    validateRecordId(recordId);
    validateHostname(hostname);
    validateAddress(address);
    final CloudflareRecordUpdateRequest request =
        new CloudflareRecordUpdateRequest(
            AddressRecordType.forAddress(address).name(), hostname, address, AUTOMATIC_TTL, false);
    final CloudflareRecordResponse response;
    try {
      response =
          cloudflareRestClient
              .put()
              .uri(
                  properties.updateRecordPath(),
                  Map.of("zoneId", properties.zoneId(), "recordId", recordId))
              .body(request)
              .retrieve()
              .body(CloudflareRecordResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "updateRecord");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "updateRecord");
    } catch (RuntimeException ex) {
      throw mapUnexpectedException(ex, "updateRecord");
    }
    requireUpdateResponse(response);
  }

  private CloudflareDnsRecord requireListResponse(
      CloudflareRecordListResponse response, String hostname, AddressRecordType type) {
    if (response == null) {
      throw new DnsProviderException(
          DnsProviderException.Reason.INVALID_RESPONSE, "cloudflare response is empty");
    }
    if (!response.success()) {
      throw rejected(response.errors());
    }
    final List<CloudflareDnsRecord> matching =
        response.result() == null
            ? List.of()
            : response.result().stream().filter(candidate -> hasType(candidate, type)).toList();
    if (matching.isEmpty()) {
      throw new DnsProviderException(
          DnsProviderException.Reason.NOT_FOUND,
          "DNS record not found: " + hostname + " type=" + type);
    }
    if (matching.size() > 1) {
      logger.debug(
          "cloudflare returned {} {} records for hostname={}, using the first",
          matching.size(),
          type,
          hostname);
    }
    return matching.get(0);
  }

  // type を返さない応答は type フィルタ済みの一覧として扱う。
  private boolean hasType(CloudflareDnsRecord record, AddressRecordType type) {
    return record != null && (record.type() == null || type.name().equals(record.type()));
  }

  private void requireUpdateResponse(CloudflareRecordResponse response) {
    if (response == null) {
      throw new DnsProviderException(
          DnsProviderException.Reason.INVALID_RESPONSE, "cloudflare response is empty");
    }
    if (!response.success()) {
      throw rejected(response.errors());
    }
  }

  private RemoteRecord toRemoteRecord(CloudflareDnsRecord record) {
    if (record == null || isBlank(record.id())) {
      throw new DnsProviderException(
          DnsProviderException.Reason.INVALID_RESPONSE, "cloudflare record has no id");
    }
    return new RemoteRecord(record.id(), record.content());
  }

  private DnsProviderException rejected(List<CloudflareApiError> errors) {
    if (errors == null || errors.isEmpty()) {
      return new DnsProviderException(
          DnsProviderException.Reason.REJECTED, "cloudflare API returned error");
    }
    return new DnsProviderException(
        DnsProviderException.Reason.REJECTED,
        "cloudflare API error: " + errors.get(0).message());
  }

  private DnsProviderException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "cloudflare {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new DnsProviderException(
          DnsProviderException.Reason.UNAUTHORIZED, "cloudflare rejected api token", ex);
    }
    if (status == 404) {
      return new DnsProviderException(
          DnsProviderException.Reason.NOT_FOUND, "cloudflare resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new DnsProviderException(
          DnsProviderException.Reason.BAD_GATEWAY, "cloudflare server error", ex);
    }
    return new DnsProviderException(
        DnsProviderException.Reason.BAD_GATEWAY, "cloudflare request failed", ex);
  }

  private DnsProviderException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("cloudflare {} timed out after {}", operation, properties.timeout());
      return new DnsProviderException(
          DnsProviderException.Reason.TIMEOUT, "cloudflare request timeout", ex);
    }
    logger.warn("cloudflare {} connection failed", operation, ex);
    return new DnsProviderException(
        DnsProviderException.Reason.BAD_GATEWAY, "cloudflare connection failed", ex);
  }

  // 本文読み取り中に期限で打ち切られた場合も抽出失敗として届くため、原因を辿って区別する。
  private DnsProviderException mapUnexpectedException(RuntimeException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn(
          "cloudflare {} timed out while reading response after {}",
          operation,
          properties.timeout());
      return new DnsProviderException(
          DnsProviderException.Reason.TIMEOUT, "cloudflare request timeout", ex);
    }
    logger.warn("cloudflare {} response parse failed", operation, ex);
    return new DnsProviderException(
        DnsProviderException.Reason.INVALID_RESPONSE, "cloudflare response parse failed", ex);
  }

  private void validateHostname(String hostname) {
    if (isBlank(hostname)) {
      throw new IllegalArgumentException("hostname is required");
    }
  }

  private void validateRecordId(String recordId) {
    if (isBlank(recordId)) {
      throw new IllegalArgumentException("recordId is required");
    }
  }

  private void validateAddress(String address) {
    if (isBlank(address)) {
      throw new IllegalArgumentException("address is required");
    }
  }

  private boolean isTimeout(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
