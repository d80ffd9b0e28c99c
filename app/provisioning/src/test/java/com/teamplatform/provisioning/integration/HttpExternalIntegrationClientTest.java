package com.teamplatform.provisioning.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.TransientProvisioningException;
import com.teamplatform.provisioning.config.IntegrationClientProperties;
import java.net.ConnectException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class HttpExternalIntegrationClientTest {

  private static final String AUTOMATIONS_URL =
      "http://integration.test/v1/tenants/tenant_1/automations";
  private static final String APPS_SCRIPT_URL =
      "http://integration.test/v1/tenants/tenant_1/apps-script:deploy";

  @Test
  void deployAutomationsSendsNamespaceAndSchedule() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(AUTOMATIONS_URL))
        .andExpect(method(PUT))
        .andExpect(header("Authorization", "Bearer integration-token"))
        .andExpect(
            content()
                .json(
                    """
                    {"storage_namespace":"tenant_tenant_1","cron_schedule":"0 */6 * * *"}
                    """))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    fixture.client.deployAutomations("tenant_1", "tenant_tenant_1", "0 */6 * * *");

    fixture.server.verify();
  }

  @Test
  void deployAppsScriptReturnsJobId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(APPS_SCRIPT_URL))
        .andExpect(method(POST))
        .andRespond(withSuccess("{\"job_id\":\"job-42\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.deployAppsScript("tenant_1")).isEqualTo("job-42");
  }

  @Test
  void deployAppsScriptWithoutJobIdIsPermanent() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(APPS_SCRIPT_URL))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.deployAppsScript("tenant_1"))
        .isInstanceOf(PermanentProvisioningException.class);
  }

  @Test
  void serverErrorsAndThrottlingAreTransient() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(AUTOMATIONS_URL))
        .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
    fixture
        .server
        .expect(requestTo(AUTOMATIONS_URL))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> fixture.client.deployAutomations("tenant_1", "ns", "0 * * * *"))
        .isInstanceOf(TransientProvisioningException.class);
    assertThatThrownBy(() -> fixture.client.deployAutomations("tenant_1", "ns", "0 * * * *"))
        .isInstanceOf(TransientProvisioningException.class);
  }

  @Test
  void clientErrorsArePermanent() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(APPS_SCRIPT_URL))
        .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

    assertThatThrownBy(() -> fixture.client.deployAppsScript("tenant_1"))
        .isInstanceOf(PermanentProvisioningException.class)
        .hasMessageContaining("422");
  }

  @Test
  void connectionFailureIsTransient() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(AUTOMATIONS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.client.deployAutomations("tenant_1", "ns", "0 * * * *"))
        .isInstanceOf(TransientProvisioningException.class);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://integration.test").build();
    final IntegrationClientProperties properties =
        new IntegrationClientProperties(
            "http", "http://integration.test", "integration-token", null, null, null, null, null);
    return new ClientFixture(new HttpExternalIntegrationClient(restClient, properties), server);
  }

  private record ClientFixture(HttpExternalIntegrationClient client, MockRestServiceServer server) {}
}
