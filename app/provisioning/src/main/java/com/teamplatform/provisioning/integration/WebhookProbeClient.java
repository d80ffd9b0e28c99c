/*
 * どこで: Provisioning 外部連携
 * 何を: テナントの webhook へ署名付き HEAD リクエストを送り、到達性を確認する
 * なぜ: Starter プランの自動化先が受信可能かをプロビジョニング中に確かめるため
 */
package com.teamplatform.provisioning.integration;

import com.google.common.annotations.VisibleForTesting;
import com.teamplatform.provisioning.actor.PermanentProvisioningException;
import com.teamplatform.provisioning.actor.TransientProvisioningException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class WebhookProbeClient {

  static final String SIGNATURE_HEADER = "X-Signature";
  static final String TIMESTAMP_HEADER = "X-Timestamp";

  private final RestClient webhookRestClient;
  private final Clock clock;

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "RestClient は共有コンポーネント")
  public WebhookProbeClient(RestClient webhookRestClient, Clock clock) {
    this.webhookRestClient = webhookRestClient;
    this.clock = clock;
  }

  /**
   * 2xx と 405 (HEAD 非対応) は到達可能とみなす。429 / 5xx / 通信エラーは一時的失敗、それ以外は恒久的失敗。
   */
  public void probe(String webhookUrl, String webhookSecret) {
    final URI uri;
    try {
      uri = URI.create(webhookUrl);
    } catch (IllegalArgumentException ex) {
      throw new PermanentProvisioningException("webhook url is invalid", ex);
    }
    final String timestamp = Long.toString(clock.millis());
    final String signature = sign(webhookSecret, "HEAD:" + timestamp);
    try {
      webhookRestClient
          .head()
          .uri(uri)
          .header(SIGNATURE_HEADER, signature)
          .header(TIMESTAMP_HEADER, timestamp)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      if (status == 405) {
        return;
      }
      if (status == 429 || status >= 500) {
        throw new TransientProvisioningException("webhook validation status " + status, ex);
      }
      throw new PermanentProvisioningException("webhook validation status " + status, ex);
    } catch (ResourceAccessException ex) {
      throw new TransientProvisioningException("webhook unreachable", ex);
    }
  }

  @VisibleForTesting
  static String sign(String secret, String payload) {
    try {
      final Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("HmacSHA256 is not available", ex);
    }
  }
}
