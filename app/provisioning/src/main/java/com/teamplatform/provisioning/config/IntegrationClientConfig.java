/*
 * どこで: Provisioning 設定
 * 何を: 外部連携・webhook 検証・キュー投入の RestClient とアダプタを提供する
 * なぜ: 呼び出し先ごとにタイムアウトと baseUrl を分けて管理するため
 */
package com.teamplatform.provisioning.config;

import com.teamplatform.provisioning.integration.ExternalIntegrationClient;
import com.teamplatform.provisioning.integration.HttpExternalIntegrationClient;
import com.teamplatform.provisioning.integration.LocalExternalIntegrationClient;
import com.teamplatform.provisioning.integration.LoggingOwnerNotifier;
import com.teamplatform.provisioning.integration.OwnerNotifier;
import com.teamplatform.provisioning.integration.WebhookProbeClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class IntegrationClientConfig {

  private static final Logger logger = LoggerFactory.getLogger(IntegrationClientConfig.class);

  @Bean
  RestClient integrationRestClient(
      RestClient.Builder builder, IntegrationClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient webhookRestClient(RestClient.Builder builder, IntegrationClientProperties properties) {
    return builder
        .requestFactory(requestFactory(properties.connectTimeout(), properties.webhookTimeout()))
        .build();
  }

  @Bean
  RestClient queueRestClient(
      RestClient.Builder builder,
      QueueClientProperties properties,
      IntegrationClientProperties integrationProperties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            requestFactory(integrationProperties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  ExternalIntegrationClient externalIntegrationClient(
      RestClient integrationRestClient, IntegrationClientProperties properties) {
    if ("http".equalsIgnoreCase(properties.mode())) {
      logger.info("external integration mode=http baseUrl={}", properties.baseUrl());
      return new HttpExternalIntegrationClient(integrationRestClient, properties);
    }
    logger.info("external integration mode=local");
    return new LocalExternalIntegrationClient();
  }

  @Bean
  WebhookProbeClient webhookProbeClient(RestClient webhookRestClient, Clock clock) {
    return new WebhookProbeClient(webhookRestClient, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  OwnerNotifier ownerNotifier() {
    return new LoggingOwnerNotifier();
  }

  private static SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
