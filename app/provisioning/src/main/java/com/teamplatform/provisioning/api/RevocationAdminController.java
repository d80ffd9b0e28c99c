package com.teamplatform.provisioning.api;

import com.teamplatform.provisioning.api.request.RevocationRequest;
import com.teamplatform.provisioning.api.response.RevocationListResponse;
import com.teamplatform.provisioning.api.response.RevocationResponse;
import com.teamplatform.provisioning.config.CredentialAuthenticationToken;
import com.teamplatform.provisioning.service.RevocationAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/tenants/{tenantId}/revocations")
@RequiredArgsConstructor
public class RevocationAdminController {

  private final RevocationAdminService revocationAdminService;

  @PostMapping
  public ResponseEntity<RevocationResponse> revoke(
      @PathVariable("tenantId") String tenantId,
      @Valid @RequestBody RevocationRequest request,
      Authentication authentication) {
    final var requester = ((CredentialAuthenticationToken) authentication).credential();
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(RevocationResponse.from(revocationAdminService.revoke(tenantId, request, requester)));
  }

  @GetMapping
  public ResponseEntity<RevocationListResponse> list(
      @PathVariable("tenantId") String tenantId,
      @RequestParam(value = "limit", required = false) Integer limit) {
    return ResponseEntity.ok(
        new RevocationListResponse(
            tenantId,
            revocationAdminService.list(tenantId, limit).stream()
                .map(RevocationResponse::from)
                .toList()));
  }
}
