package com.example.dyndns_proxy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 役割:
 * - /nic/update の Basic 認証に使う資格情報を保持する。
 *
 * 前提:
 * - username と password が両方とも空でないときだけ認証を有効にする。
 */
@ConfigurationProperties(prefix = "dyndns.basic-auth")
public record DynDnsAuthProperties(String username, String password) {

  public DynDnsAuthProperties {
    username = username == null ? "" : username;
    password = password == null ? "" : password;
  }

  public boolean enabled() {
    return !username.isEmpty() && !password.isEmpty();
  }
}
