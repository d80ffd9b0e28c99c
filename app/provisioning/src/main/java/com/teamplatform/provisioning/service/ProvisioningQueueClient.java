/*
 * どこで: Provisioning サービス層
 * 何を: 内部サービス資格情報を付けて /internal/provision/queue を呼び出す
 * なぜ: サインアップ応答を待たせずに、認可された経路でプロビジョニングを開始するため
 */
package com.teamplatform.provisioning.service;

import com.teamplatform.provisioning.config.QueueClientProperties;
import com.teamplatform.provisioning.credential.CredentialIssuer;
import com.teamplatform.provisioning.credential.IssuedCredential;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class ProvisioningQueueClient {

  private static final Logger logger = LoggerFactory.getLogger(ProvisioningQueueClient.class);
  static final String SERVICE_NAME = "signup";

  private final RestClient queueRestClient;
  private final QueueClientProperties properties;
  private final CredentialIssuer credentialIssuer;
  private final ExecutorService queueClientExecutor;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient と ExecutorService は Spring 管理の共有コンポーネントのため")
  public ProvisioningQueueClient(
      RestClient queueRestClient,
      QueueClientProperties properties,
      CredentialIssuer credentialIssuer,
      ExecutorService queueClientExecutor) {
    this.queueRestClient = queueRestClient;
    this.properties = properties;
    this.credentialIssuer = credentialIssuer;
    this.queueClientExecutor = queueClientExecutor;
  }

  /** 失敗はログに残すだけで呼び出し元へは伝えない。後から retry API で再投入できる。 */
  public CompletableFuture<Void> queueAsync(String tenantId) {
    return CompletableFuture.runAsync(() -> queue(tenantId), queueClientExecutor)
        .exceptionally(
            error -> {
              logger.warn("provisioning queue call failed tenantId={}", tenantId, error);
              return null;
            });
  }

  public void queue(String tenantId) {
    final IssuedCredential credential = credentialIssuer.issueInternalService(SERVICE_NAME);
    queueRestClient
        .post()
        .uri(properties.queuePath())
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential.token())
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("tenantId", tenantId))
        .retrieve()
        .toBodilessEntity();
    logger.info("provisioning queue accepted tenantId={}", tenantId);
  }
}
