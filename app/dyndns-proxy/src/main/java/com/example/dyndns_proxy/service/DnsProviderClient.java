package com.example.dyndns_proxy.service;

import com.example.dyndns_proxy.model.AddressRecordType;
import com.example.dyndns_proxy.model.RemoteRecord;

/**
 * 役割:
 * - 更新ハンドラから見た DNS ホスティング API の境界。
 *
 * 前提:
 * - 実装は 1 呼び出しを設定済みタイムアウト内に収め、失敗はすべて {@link DnsProviderException}
 *   で通知する。
 */
public interface DnsProviderClient {

  /**
   * 役割:
   * - 設定ゾーン内で hostname と種別が一致するアドレスレコードを取得する。
   *
   * 期待動作:
   * - 複数件返った場合はプロバイダの返却順で先頭を採用する。
   * - 該当なしは {@link DnsProviderException.Reason#NOT_FOUND} とする。
   * - 別種別(A に対する AAAA など)のレコードは対象にしない。
   */
  RemoteRecord fetchRecord(String hostname, AddressRecordType type);

  /**
   * 役割:
   * - recordId のレコード内容を address で置き換える。種別は address から決める。
   *
   * 期待動作:
   * - 呼び出し失敗や API 側の拒否は {@link DnsProviderException} とする。
   */
  void updateRecord(String recordId, String hostname, String address);
}
