/*
 * どこで: Provisioning 外部連携
 * 何を: 外部連携 API を RestClient で呼び出し、失敗を一時的/恒久的に分類する
 * なぜ: ステップの再試行判定を HTTP ステータスと通信エラーの種類で決めるため
 */
package com.teamplatform.provisioning.integration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.TransientProvisioningException;
import com.teamplatform.provisioning.config.IntegrationClientProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class HttpExternalIntegrationClient implements ExternalIntegrationClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpExternalIntegrationClient.class);

  private final RestClient integrationRestClient;
  private final IntegrationClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpExternalIntegrationClient(
      RestClient integrationRestClient, IntegrationClientProperties properties) {
    this.integrationRestClient = integrationRestClient;
    this.properties = properties;
  }

  @Override
  public void deployAutomations(String tenantId, String storageNamespace, String cronSchedule) {
    try {
      integrationRestClient
          .put()
          .uri(properties.automationsPath(), tenantId)
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of("storage_namespace", storageNamespace, "cron_schedule", cronSchedule))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException("deployAutomations", ex);
    } catch (ResourceAccessException ex) {
      throw new TransientProvisioningException("integration unreachable", ex);
    }
  }

  @Override
  public String deployAppsScript(String tenantId) {
    final DeployResponse response;
    try {
      response =
          integrationRestClient
              .post()
              .uri(properties.appsScriptPath(), tenantId)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
              .retrieve()
              .body(DeployResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException("deployAppsScript", ex);
    } catch (ResourceAccessException ex) {
      throw new TransientProvisioningException("integration unreachable", ex);
    } catch (RestClientException ex) {
      throw new PermanentProvisioningException("integration response is invalid", ex);
    }
    if (response == null || response.jobId() == null || response.jobId().isBlank()) {
      throw new PermanentProvisioningException("integration response is missing job_id");
    }
    return response.jobId();
  }

  private RuntimeException mapResponseException(String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn("integration call failed operation={} status={}", operation, status);
    if (status == 429 || status >= 500) {
      return new TransientProvisioningException("integration returned " + status, ex);
    }
    return new PermanentProvisioningException("integration rejected request with " + status, ex);
  }

  record DeployResponse(@JsonProperty("job_id") String jobId) {}
}
