/*
 * どこで: Provisioning API
 * 何を: 内部サービス向けの queue / retry と、状態参照の HTTP 入口を提供する
 * なぜ: 認可済みのリクエストだけを ProvisioningService に渡すため
 */
package com.teamplatform.provisioning.api;

import com.teamplatform.provisioning.actor.ProvisioningStatus;
import com.teamplatform.provisioning.api.request.TenantIdRequest;
import com.teamplatform.provisioning.api.response.ProvisionQueueResponse;
import com.teamplatform.provisioning.api.response.ProvisionStatusResponse;
import com.teamplatform.provisioning.service.ProvisioningOutcome;
import com.teamplatform.provisioning.service.ProvisioningService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ProvisioningController {

  private final ProvisioningService provisioningService;

  @PostMapping("/internal/provision/queue")
  public ResponseEntity<ProvisionQueueResponse> queue(
      @RequestBody(required = false) TenantIdRequest request) {
    return toResponse(provisioningService.queueAndRun(requireTenantId(request)));
  }

  @PostMapping("/internal/provision/retry")
  public ResponseEntity<ProvisionQueueResponse> retry(
      @RequestBody(required = false) TenantIdRequest request) {
    return toResponse(provisioningService.retry(requireTenantId(request)));
  }

  @GetMapping("/tenants/{tenantId}/provision-status")
  public ResponseEntity<ProvisionStatusResponse> status(@PathVariable("tenantId") String tenantId) {
    return ResponseEntity.ok(ProvisionStatusResponse.from(provisioningService.status(tenantId)));
  }

  private ResponseEntity<ProvisionQueueResponse> toResponse(ProvisioningOutcome outcome) {
    final ProvisionStatusResponse state = ProvisionStatusResponse.from(outcome.snapshot());
    if (outcome.inFlight()) {
      return ResponseEntity.status(HttpStatus.ACCEPTED)
          .body(new ProvisionQueueResponse(true, "Provisioning in progress", state));
    }
    final String message =
        outcome.snapshot().status() == ProvisioningStatus.COMPLETED
            ? "Provisioning completed"
            : "Provisioning " + outcome.snapshot().status().value();
    return ResponseEntity.ok(new ProvisionQueueResponse(true, message, state));
  }

  private String requireTenantId(TenantIdRequest request) {
    if (request == null || request.tenantId() == null || request.tenantId().isBlank()) {
      throw new MissingTenantIdException();
    }
    return request.tenantId().trim();
  }
}
