/*
 * どこで: Provisioning アプリの設定バインド
 * 何を: 冪等性レコードと予約マーカーの TTL を保持する
 * なぜ: 保持期間と処理中予約の寿命を運用で調整できるようにするため
 */
package com.teamplatform.provisioning.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "idempotency")
public record IdempotencyProperties(Duration ttl, Duration reservationTtl) {

  public IdempotencyProperties {
    ttl = ttl == null ? Duration.ofHours(24) : ttl;
    reservationTtl = reservationTtl == null ? Duration.ofSeconds(60) : reservationTtl;
  }
}
