package com.teamplatform.provisioning.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.HEAD;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.TransientProvisioningException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class WebhookProbeClientTest {

  private static final String WEBHOOK_URL = "https://hooks.tigers.test/provision";
  private static final String SECRET = "club-webhook-secret-0001";
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

  private final RestClient.Builder builder = RestClient.builder();
  private final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
  private final WebhookProbeClient client = new WebhookProbeClient(builder.build(), CLOCK);

  @Test
  void probeSendsSignedHeadRequest() {
    final String timestamp = Long.toString(CLOCK.millis());
    server
        .expect(requestTo(WEBHOOK_URL))
        .andExpect(method(HEAD))
        .andExpect(header(WebhookProbeClient.TIMESTAMP_HEADER, timestamp))
        .andExpect(
            header(
                WebhookProbeClient.SIGNATURE_HEADER,
                WebhookProbeClient.sign(SECRET, "HEAD:" + timestamp)))
        .andRespond(withSuccess());

    client.probe(WEBHOOK_URL, SECRET);

    server.verify();
  }

  @Test
  void signatureIsHexHmac() {
    assertThat(WebhookProbeClient.sign(SECRET, "HEAD:1")).matches("[0-9a-f]{64}");
    assertThat(WebhookProbeClient.sign(SECRET, "HEAD:1"))
        .isNotEqualTo(WebhookProbeClient.sign("another-secret-value", "HEAD:1"));
  }

  @Test
  void methodNotAllowedCountsAsReachable() {
    server.expect(requestTo(WEBHOOK_URL)).andRespond(withStatus(HttpStatus.METHOD_NOT_ALLOWED));

    assertThatCode(() -> client.probe(WEBHOOK_URL, SECRET)).doesNotThrowAnyException();
  }

  @Test
  void serverErrorIsTransientAndNotFoundIsPermanent() {
    server.expect(requestTo(WEBHOOK_URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));
    server.expect(requestTo(WEBHOOK_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> client.probe(WEBHOOK_URL, SECRET))
        .isInstanceOf(TransientProvisioningException.class);
    assertThatThrownBy(() -> client.probe(WEBHOOK_URL, SECRET))
        .isInstanceOf(PermanentProvisioningException.class);
  }

  @Test
  void timeoutIsTransient() {
    server
        .expect(requestTo(WEBHOOK_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> client.probe(WEBHOOK_URL, SECRET))
        .isInstanceOf(TransientProvisioningException.class);
  }

  @Test
  void invalidUrlIsPermanent() {
    assertThatThrownBy(() -> client.probe("https://bad url with spaces", SECRET))
        .isInstanceOf(PermanentProvisioningException.class);
  }
}
