/*
 * どこで: Provisioning インフラ設定
 * 何を: store.type に応じて KeyValueStore 実装を選択する
 * なぜ: ローカル/テストはメモリ、本番は Redis と切り替えられるようにするため
 */
package com.teamplatform.provisioning.config;

import com.teamplatform.common.store.InMemoryKeyValueStore;
import com.teamplatform.common.store.KeyValueStore;
import com.teamplatform.provisioning.store.RedisKeyValueStore;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class StoreConfig {

  @Bean
  @ConditionalOnProperty(prefix = "store", name = "type", havingValue = "redis")
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  @ConditionalOnProperty(prefix = "store", name = "type", havingValue = "redis")
  KeyValueStore redisKeyValueStore(StringRedisTemplate stringRedisTemplate, StoreProperties properties) {
    return new RedisKeyValueStore(stringRedisTemplate, properties.keyPrefix());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "store",
      name = "type",
      havingValue = "memory",
      matchIfMissing = true)
  KeyValueStore inMemoryKeyValueStore(Clock clock) {
    return new InMemoryKeyValueStore(clock);
  }
}
