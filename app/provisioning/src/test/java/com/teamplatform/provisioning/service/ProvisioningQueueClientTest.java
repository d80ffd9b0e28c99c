package com.teamplatform.provisioning.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

import com.teamplatform.provisioning.config.QueueClientProperties;
import com.teamplatform.provisioning.credential.CredentialAudience;
import com.teamplatform.provisioning.credential.VerifiedCredential;
import com.teamplatform.provisioning.support.CredentialFixture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ProvisioningQueueClientTest {

  private static final String QUEUE_URL = "http://provisioning.test/internal/provision/queue";

  private final CredentialFixture fixture = new CredentialFixture();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private final RestClient.Builder builder = RestClient.builder();
  private final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
  private final ProvisioningQueueClient client =
      new ProvisioningQueueClient(
          builder.baseUrl("http://provisioning.test").build(),
          new QueueClientProperties("http://provisioning.test", null, null),
          fixture.issuer,
          executor);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void queuePostsTenantIdWithInternalServiceCredential() {
    final AtomicReference<String> authorization = new AtomicReference<>();
    server
        .expect(requestTo(QUEUE_URL))
        .andExpect(method(POST))
        .andExpect(request -> authorization.set(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION)))
        .andExpect(content().json("{\"tenantId\":\"tenant_1\"}"))
        .andRespond(withStatus(HttpStatus.ACCEPTED));

    client.queue("tenant_1");

    server.verify();
    assertThat(authorization.get()).startsWith("Bearer ");
    final VerifiedCredential credential =
        fixture.verifier.verify(
            authorization.get().substring("Bearer ".length()), CredentialAudience.INTERNAL_SERVICE);
    assertThat(credential.subject()).isEqualTo(ProvisioningQueueClient.SERVICE_NAME);
  }

  @Test
  void queueAsyncCompletesNormallyWhenQueueCallFails() {
    server.expect(requestTo(QUEUE_URL)).andRespond(withServerError());

    assertThatCode(() -> client.queueAsync("tenant_1").get(5, TimeUnit.SECONDS))
        .doesNotThrowAnyException();
    server.verify();
  }
}
