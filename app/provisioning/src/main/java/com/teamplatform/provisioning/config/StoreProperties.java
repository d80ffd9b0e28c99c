package com.teamplatform.provisioning.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** type は memory か redis。keyPrefix は Redis 上のキーにのみ付与する。 */
@ConfigurationProperties(prefix = "store")
public record StoreProperties(String type, String keyPrefix) {

  public StoreProperties {
    type = type == null || type.isBlank() ? "memory" : type;
    keyPrefix = keyPrefix == null ? "tp:" : keyPrefix;
  }
}
