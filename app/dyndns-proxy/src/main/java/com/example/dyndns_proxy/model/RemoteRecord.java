package com.example.dyndns_proxy.model;

/** プロバイダ上のアドレスレコード 1 件。id は不透明な識別子、address は現在の内容。 */
public record RemoteRecord(String id, String address) {}
