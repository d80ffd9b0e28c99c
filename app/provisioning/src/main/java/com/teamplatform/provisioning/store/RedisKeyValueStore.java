/*
 * どこで: Provisioning インフラ層
 * 何を: KeyValueStore を Redis の文字列キーで実装する
 * なぜ: 複数インスタンス間で冪等性・失効・プロビジョニング状態を共有するため
 */
package com.teamplatform.provisioning.store;

import com.teamplatform.common.store.KeyValueStore;
import com.teamplatform.common.store.StoreUnavailableException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisKeyValueStore implements KeyValueStore {

  private static final long SCAN_BATCH_SIZE = 200;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final String keyPrefix;

  public RedisKeyValueStore(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public Optional<String> get(String key) {
    return call("get", () -> Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key))));
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    call(
        "put",
        () -> {
          if (ttl == null) {
            redisTemplate.opsForValue().set(redisKey(key), value);
          } else {
            redisTemplate.opsForValue().set(redisKey(key), value, ttl);
          }
          return null;
        });
  }

  @Override
  public boolean putIfAbsent(String key, String value, Duration ttl) {
    return call(
        "putIfAbsent",
        () -> {
          final Boolean stored =
              ttl == null
                  ? redisTemplate.opsForValue().setIfAbsent(redisKey(key), value)
                  : redisTemplate.opsForValue().setIfAbsent(redisKey(key), value, ttl);
          return Boolean.TRUE.equals(stored);
        });
  }

  @Override
  public void delete(String key) {
    call("delete", () -> redisTemplate.delete(redisKey(key)));
  }

  @Override
  public Map<String, String> listByPrefix(String prefix, int limit) {
    return call(
        "listByPrefix",
        () -> {
          final List<String> keys = new ArrayList<>();
          final ScanOptions options =
              ScanOptions.scanOptions().match(redisKey(prefix) + "*").count(SCAN_BATCH_SIZE).build();
          try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext() && keys.size() < limit) {
              keys.add(cursor.next());
            }
          }
          final Map<String, String> result = new LinkedHashMap<>();
          if (keys.isEmpty()) {
            return result;
          }
          final List<String> values = redisTemplate.opsForValue().multiGet(keys);
          for (int i = 0; i < keys.size(); i++) {
            final String value = values == null ? null : values.get(i);
            // SCAN と MGET の間に期限切れになったキーは除外する
            if (value != null) {
              result.put(keys.get(i).substring(keyPrefix.length()), value);
            }
          }
          return result;
        });
  }

  private String redisKey(String key) {
    return keyPrefix + key;
  }

  private <T> T call(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("redis " + operation + " failed", ex);
    }
  }
}
