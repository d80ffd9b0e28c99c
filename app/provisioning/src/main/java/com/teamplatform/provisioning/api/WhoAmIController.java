package com.teamplatform.provisioning.api;

import com.teamplatform.provisioning.api.response.WhoAmIResponse;
import com.teamplatform.provisioning.config.AuthProperties;
import com.teamplatform.provisioning.config.CredentialAuthenticationToken;
import com.teamplatform.provisioning.credential.VerifiedCredential;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** 検証済みクレームだけを返す。トークンや署名鍵に関わる値は返さない。 */
@RestController
@RequiredArgsConstructor
public class WhoAmIController {

  private final AuthProperties authProperties;

  @GetMapping("/whoami")
  public ResponseEntity<WhoAmIResponse> whoami(Authentication authentication) {
    final VerifiedCredential credential =
        ((CredentialAuthenticationToken) authentication).credential();
    return ResponseEntity.ok(
        new WhoAmIResponse(
            credential.subject(),
            credential.tenantId(),
            credential.isPlatformScoped(),
            credential.audience().claimValue(authProperties),
            credential.roles(),
            credential.email(),
            credential.jti(),
            iso(credential.issuedAt()),
            iso(credential.expiresAt())));
  }

  private String iso(Instant instant) {
    return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
  }
}
