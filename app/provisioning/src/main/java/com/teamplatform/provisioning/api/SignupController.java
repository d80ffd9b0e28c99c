package com.teamplatform.provisioning.api;

import com.teamplatform.provisioning.api.request.SignupRequest;
import com.teamplatform.provisioning.api.response.SignupResponse;
import com.teamplatform.provisioning.service.SignupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SignupController {

  private final SignupService signupService;

  @PostMapping("/public/signup")
  public ResponseEntity<SignupResponse> signup(
      @Valid @RequestBody SignupRequest request,
      @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {
    return ResponseEntity.ok(signupService.signup(request, idempotencyKey));
  }
}
