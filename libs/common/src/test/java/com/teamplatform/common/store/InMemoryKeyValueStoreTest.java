package com.teamplatform.common.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

  @Test
  void getReturnsEmptyAfterTtlElapses() {
    store.put("idem:a", "v1", Duration.ofSeconds(10));

    assertThat(store.get("idem:a")).contains("v1");

    clock.advance(Duration.ofSeconds(10));

    assertThat(store.get("idem:a")).isEmpty();
  }

  @Test
  void putWithoutTtlNeverExpires() {
    store.put("provision:state:t1", "{}", null);

    clock.advance(Duration.ofDays(3650));

    assertThat(store.get("provision:state:t1")).contains("{}");
  }

  @Test
  void putIfAbsentKeepsLiveValueAndReplacesExpiredOne() {
    assertThat(store.putIfAbsent("k", "first", Duration.ofSeconds(5))).isTrue();
    assertThat(store.putIfAbsent("k", "second", Duration.ofSeconds(5))).isFalse();
    assertThat(store.get("k")).contains("first");

    clock.advance(Duration.ofSeconds(6));

    assertThat(store.putIfAbsent("k", "third", Duration.ofSeconds(5))).isTrue();
    assertThat(store.get("k")).contains("third");
  }

  @Test
  void listByPrefixSkipsOtherPrefixesAndExpiredEntries() {
    store.put("jwt:revoked:a", "1", Duration.ofSeconds(30));
    store.put("jwt:revoked:b", "2", Duration.ofSeconds(1));
    store.put("idem:c", "3", Duration.ofSeconds(30));
    clock.advance(Duration.ofSeconds(2));

    assertThat(store.listByPrefix("jwt:revoked:", 10)).containsOnlyKeys("jwt:revoked:a");
  }

  @Test
  void listByPrefixHonorsLimit() {
    for (int i = 0; i < 5; i++) {
      store.put("p:" + i, "v", null);
    }

    assertThat(store.listByPrefix("p:", 3)).hasSize(3);
  }

  @Test
  void deleteRemovesEntry() {
    store.put("k", "v", null);

    store.delete("k");

    assertThat(store.get("k")).isEmpty();
  }

  static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
