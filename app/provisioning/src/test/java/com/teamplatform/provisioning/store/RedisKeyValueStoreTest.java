package com.teamplatform.provisioning.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.teamplatform.common.store.StoreUnavailableException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class RedisKeyValueStoreTest {

  @SuppressWarnings("unchecked")
  private final ValueOperations<String, String> valueOps = Mockito.mock(ValueOperations.class);

  private final StringRedisTemplate redisTemplate = Mockito.mock(StringRedisTemplate.class);
  private final RedisKeyValueStore store = new RedisKeyValueStore(redisTemplate, "tp:");

  RedisKeyValueStoreTest() {
    when(redisTemplate.opsForValue()).thenReturn(valueOps);
  }

  @Test
  void keysArePrefixedAndTtlIsPassedThrough() {
    when(valueOps.get("tp:idem:key-1")).thenReturn("{}");
    when(valueOps.setIfAbsent("tp:idem:key-2", "v", Duration.ofSeconds(60))).thenReturn(true);

    assertThat(store.get("idem:key-1")).contains("{}");
    assertThat(store.putIfAbsent("idem:key-2", "v", Duration.ofSeconds(60))).isTrue();
    store.put("jwt:revoked:token:j1", "entry", Duration.ofMinutes(5));
    store.put("provision:state:t1", "state", null);
    store.delete("idem:key-1");

    verify(valueOps).set("tp:jwt:revoked:token:j1", "entry", Duration.ofMinutes(5));
    verify(valueOps).set("tp:provision:state:t1", "state");
    verify(redisTemplate).delete("tp:idem:key-1");
  }

  @Test
  void putIfAbsentTreatsNullReplyAsNotStored() {
    when(valueOps.setIfAbsent("tp:k", "v", Duration.ofSeconds(1))).thenReturn(null);

    assertThat(store.putIfAbsent("k", "v", Duration.ofSeconds(1))).isFalse();
  }

  @SuppressWarnings("unchecked")
  @Test
  void listByPrefixStripsStorePrefixAndSkipsVanishedKeys() {
    final Cursor<String> cursor = Mockito.mock(Cursor.class);
    when(cursor.hasNext()).thenReturn(true, true, false);
    when(cursor.next()).thenReturn("tp:jwt:revoked:token:a", "tp:jwt:revoked:token:b");
    when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
    when(valueOps.multiGet(List.of("tp:jwt:revoked:token:a", "tp:jwt:revoked:token:b")))
        .thenReturn(Arrays.asList("entry-a", null));

    assertThat(store.listByPrefix("jwt:revoked:", 10))
        .containsOnlyKeys("jwt:revoked:token:a")
        .containsEntry("jwt:revoked:token:a", "entry-a");
    verify(cursor).close();
  }

  @Test
  void redisFailureIsReportedAsStoreUnavailable() {
    when(valueOps.get("tp:k")).thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThatThrownBy(() -> store.get("k"))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessage("redis get failed");
  }
}
