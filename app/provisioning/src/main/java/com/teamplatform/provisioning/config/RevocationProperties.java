package com.teamplatform.provisioning.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "revocation")
public record RevocationProperties(Duration minTokenTtl, int defaultListLimit, int maxListLimit) {

  public RevocationProperties {
    minTokenTtl = minTokenTtl == null ? Duration.ofSeconds(60) : minTokenTtl;
    defaultListLimit = defaultListLimit <= 0 ? 50 : defaultListLimit;
    maxListLimit = maxListLimit <= 0 ? 200 : maxListLimit;
  }
}
