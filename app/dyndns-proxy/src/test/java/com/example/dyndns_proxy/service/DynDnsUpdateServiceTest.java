package com.example.dyndns_proxy.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.dyndns_proxy.model.AddressRecordType;
import com.example.dyndns_proxy.model.DynDnsResponseCode;
import com.example.dyndns_proxy.model.RemoteRecord;
import com.example.dyndns_proxy.model.UpdateOutcome;
import com.example.dyndns_proxy.model.UpdateRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class DynDnsUpdateServiceTest {

  private DnsProviderClient dnsProviderClient;
  private DynDnsMetrics dynDnsMetrics;
  private DynDnsUpdateService service;

  @BeforeEach
  void setUp() {
    dnsProviderClient = Mockito.mock(DnsProviderClient.class);
    dynDnsMetrics = Mockito.mock(DynDnsMetrics.class);
    service = new DynDnsUpdateService(dnsProviderClient, dynDnsMetrics);
  }

  @Test
  void updateReturnsGoodAfterSingleUpdateWhenAddressChanged() {
    when(dnsProviderClient.fetchRecord("test.example.com", AddressRecordType.A))
        .thenReturn(new RemoteRecord("rec123", "1.1.1.1"));

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", "1.2.3.4", "127.0.0.1"));

    assertThat(outcome.code()).isEqualTo(DynDnsResponseCode.GOOD);
    assertThat(outcome.responseBody()).isEqualTo("good 1.2.3.4");
    assertThat(outcome.httpStatus()).isEqualTo(200);
    verify(dnsProviderClient, times(1)).updateRecord("rec123", "test.example.com", "1.2.3.4");
    verify(dynDnsMetrics).recordUpdateResult("good");
  }

  @Test
  void updateReturnsNochgWithoutWriteWhenAddressUnchanged() {
    when(dnsProviderClient.fetchRecord("test.example.com", AddressRecordType.A))
        .thenReturn(new RemoteRecord("rec123", "1.1.1.1"));

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", "1.1.1.1", "127.0.0.1"));

    assertThat(outcome.responseBody()).isEqualTo("nochg 1.1.1.1");
    assertThat(outcome.httpStatus()).isEqualTo(200);
    verify(dnsProviderClient, never()).updateRecord(any(), any(), any());
  }

  @Test
  void updateComparesAddressesExactly() {
    when(dnsProviderClient.fetchRecord("v6.example.com", AddressRecordType.AAAA))
        .thenReturn(new RemoteRecord("rec6", "2001:DB8::1"));

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("v6.example.com", "2001:db8::1", null));

    assertThat(outcome.code()).isEqualTo(DynDnsResponseCode.GOOD);
    verify(dnsProviderClient).updateRecord("rec6", "v6.example.com", "2001:db8::1");
  }

  @Test
  void updateReturnsNotfqdnWithoutProviderCallWhenHostnameMissing() {
    final UpdateOutcome outcome = service.update(new UpdateRequest(null, "1.2.3.4", "127.0.0.1"));

    assertThat(outcome.responseBody()).isEqualTo("notfqdn");
    assertThat(outcome.httpStatus()).isEqualTo(400);
    verifyNoInteractions(dnsProviderClient);
    verify(dynDnsMetrics).recordUpdateResult("notfqdn");
  }

  @Test
  void updateReturnsNotfqdnBeforeAddressValidation() {
    final UpdateOutcome outcome = service.update(new UpdateRequest("", "invalid", null));

    assertThat(outcome.code()).isEqualTo(DynDnsResponseCode.NOTFQDN);
    verifyNoInteractions(dnsProviderClient);
  }

  @Test
  void updateReturnsBadipWithoutProviderCallWhenAddressInvalid() {
    for (String address : new String[] {"invalid", "192.168.1", "192.168.1.1.1", "1..2.3"}) {
      final UpdateOutcome outcome =
          service.update(new UpdateRequest("test.example.com", address, "127.0.0.1"));

      assertThat(outcome.responseBody()).as(address).isEqualTo("badip");
      assertThat(outcome.httpStatus()).isEqualTo(400);
    }
    verifyNoInteractions(dnsProviderClient);
  }

  @Test
  void updateUsesObservedAddressWhenMyipAbsent() {
    when(dnsProviderClient.fetchRecord("test.example.com", AddressRecordType.A))
        .thenReturn(new RemoteRecord("rec123", "1.1.1.1"));

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", "", "10.0.0.1"));

    assertThat(outcome.responseBody()).isEqualTo("good 10.0.0.1");
    verify(dnsProviderClient).updateRecord("rec123", "test.example.com", "10.0.0.1");
  }

  @Test
  void updateReturnsBadipWhenObservedAddressUnusable() {
    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", null, "localhost"));

    assertThat(outcome.code()).isEqualTo(DynDnsResponseCode.BADIP);
    verifyNoInteractions(dnsProviderClient);
  }

  @Test
  void updateReturns911WhenRecordNotFound() {
    when(dnsProviderClient.fetchRecord("test.example.com", AddressRecordType.A))
        .thenThrow(
            new DnsProviderException(
                DnsProviderException.Reason.NOT_FOUND, "DNS record not found: test.example.com"));

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", "1.2.3.4", null));

    assertThat(outcome.responseBody()).isEqualTo("911");
    assertThat(outcome.httpStatus()).isEqualTo(500);
    verify(dnsProviderClient, never()).updateRecord(any(), any(), any());
  }

  @Test
  void updateReturns911WhenFetchFails() {
    when(dnsProviderClient.fetchRecord("test.example.com", AddressRecordType.A))
        .thenThrow(
            new DnsProviderException(DnsProviderException.Reason.TIMEOUT, "cloudflare timeout"));

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", "1.2.3.4", null));

    assertThat(outcome.code()).isEqualTo(DynDnsResponseCode.DNSERR);
    verify(dnsProviderClient, never()).updateRecord(any(), any(), any());
    verify(dynDnsMetrics).recordProviderCall(any(), eq("fetch"), eq("TIMEOUT"));
  }

  @Test
  void updateReturns911WhenUpdateFails() {
    when(dnsProviderClient.fetchRecord("test.example.com", AddressRecordType.A))
        .thenReturn(new RemoteRecord("rec123", "1.1.1.1"));
    doThrow(
            new DnsProviderException(
                DnsProviderException.Reason.REJECTED, "cloudflare API error: bad content"))
        .when(dnsProviderClient)
        .updateRecord("rec123", "test.example.com", "1.2.3.4");

    final UpdateOutcome outcome =
        service.update(new UpdateRequest("test.example.com", "1.2.3.4", null));

    assertThat(outcome.responseBody()).isEqualTo("911");
    assertThat(outcome.httpStatus()).isEqualTo(500);
    verify(dnsProviderClient, times(1)).fetchRecord("test.example.com", AddressRecordType.A);
    verify(dnsProviderClient, times(1)).updateRecord("rec123", "test.example.com", "1.2.3.4");
    verify(dynDnsMetrics).recordUpdateResult("911");
  }
}
