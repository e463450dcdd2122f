/*
 * どこで: DynDNS プロキシのエントリポイント
 * 何を: Spring Boot を起動する
 * なぜ: DynDNS 受付 API と Cloudflare 連携を単一アプリとして起動するため
 */
package com.example.dyndns_proxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class DynDnsProxyApplication {

  public static void main(String[] args) {
    SpringApplication.run(DynDnsProxyApplication.class, args);
  }
}
