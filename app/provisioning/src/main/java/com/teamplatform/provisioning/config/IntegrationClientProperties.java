package com.teamplatform.provisioning.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** mode=http で外部連携 API を呼び出し、それ以外はローカル実装を使う。 */
@ConfigurationProperties(prefix = "integration")
public record IntegrationClientProperties(
    String mode,
    String baseUrl,
    String apiToken,
    String automationsPath,
    String appsScriptPath,
    Duration connectTimeout,
    Duration readTimeout,
    Duration webhookTimeout) {

  public IntegrationClientProperties {
    mode = mode == null || mode.isBlank() ? "local" : mode;
    baseUrl = baseUrl == null ? "http://integration:80" : baseUrl;
    apiToken = apiToken == null ? "" : apiToken;
    automationsPath =
        automationsPath == null || automationsPath.isBlank()
            ? "/v1/tenants/{tenantId}/automations"
            : automationsPath;
    appsScriptPath =
        appsScriptPath == null || appsScriptPath.isBlank()
            ? "/v1/tenants/{tenantId}/apps-script:deploy"
            : appsScriptPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    webhookTimeout = webhookTimeout == null ? Duration.ofSeconds(5) : webhookTimeout;
  }
}
