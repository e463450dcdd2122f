package com.example.common.http;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ForwardedAddressesTest {

  @Test
  void firstForwardedForTakesFirstEntryTrimmed() {
    assertThat(ForwardedAddresses.firstForwardedFor(" 10.0.0.1 , 10.0.0.2")).isEqualTo("10.0.0.1");
  }

  @Test
  void firstForwardedForReturnsSingleEntry() {
    assertThat(ForwardedAddresses.firstForwardedFor("10.0.0.9")).isEqualTo("10.0.0.9");
  }

  @Test
  void firstForwardedForReturnsNullWhenAbsent() {
    assertThat(ForwardedAddresses.firstForwardedFor(null)).isNull();
    assertThat(ForwardedAddresses.firstForwardedFor("")).isNull();
  }

  @Test
  void firstForwardedForReturnsEmptyForWhitespaceOnlyHeader() {
    assertThat(ForwardedAddresses.firstForwardedFor("  ")).isEmpty();
    assertThat(ForwardedAddresses.firstForwardedFor(" , 10.0.0.2")).isEmpty();
  }

  @Test
  void stripPortRemovesIpv4Port() {
    assertThat(ForwardedAddresses.stripPort("192.168.1.1:12345")).isEqualTo("192.168.1.1");
  }

  @Test
  void stripPortRemovesBracketsAndPortFromIpv6() {
    assertThat(ForwardedAddresses.stripPort("[2001:db8::1]:443")).isEqualTo("2001:db8::1");
  }

  @Test
  void stripPortKeepsBareAddresses() {
    assertThat(ForwardedAddresses.stripPort("192.168.1.1")).isEqualTo("192.168.1.1");
    assertThat(ForwardedAddresses.stripPort("0:0:0:0:0:0:0:1")).isEqualTo("0:0:0:0:0:0:0:1");
    assertThat(ForwardedAddresses.stripPort(null)).isNull();
  }
}
