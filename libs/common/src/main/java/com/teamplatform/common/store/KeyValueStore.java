/*
 * どこで: Common ストア抽象
 * 何を: TTL 付きのキー/値ストア操作を定義する
 * なぜ: 冪等性台帳・失効台帳・プロビジョニング状態を同じ抽象で保存し、実装を差し替えられるようにするため
 */
package com.teamplatform.common.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * 役割: 文字列キーと文字列値を保存するストアの最小契約。
 *
 * <p>期待動作: 期限切れのエントリは存在しないものとして扱う。ストアへ到達できない場合は {@link
 * StoreUnavailableException} を送出する。
 */
public interface KeyValueStore {

  Optional<String> get(String key);

  /**
   * 値を上書き保存する。
   *
   * @param ttl null の場合は期限なし
   */
  void put(String key, String value, Duration ttl);

  /**
   * キーが存在しない場合のみ保存する。
   *
   * @return 保存できた場合 true
   */
  boolean putIfAbsent(String key, String value, Duration ttl);

  void delete(String key);

  /** prefix に一致するエントリを最大 limit 件返す。順序は保証しない。 */
  Map<String, String> listByPrefix(String prefix, int limit);
}
