package com.teamplatform.provisioning.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "provisioning.queue-client")
public record QueueClientProperties(String baseUrl, String queuePath, Duration readTimeout) {

  public QueueClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:8080" : baseUrl;
    queuePath = queuePath == null || queuePath.isBlank() ? "/internal/provision/queue" : queuePath;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
  }
}
