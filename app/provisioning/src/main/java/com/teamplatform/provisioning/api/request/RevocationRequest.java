package com.teamplatform.provisioning.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/** level=token なら token (テナント管理者) または jti (プラットフォーム管理者)、level=principal なら subject が必須。 */
public record RevocationRequest(
    @NotBlank(message = "level is required")
        @Pattern(regexp = "^(token|principal|tenant)$", message = "level must be token, principal or tenant")
        String level,
    String subject,
    String jti,
    String token,
    @NotBlank(message = "reason is required") @Size(max = 200) String reason,
    @Positive(message = "ttlSeconds must be positive") Long ttlSeconds) {}
