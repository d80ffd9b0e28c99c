/*
 * どこで: Provisioning API DTO
 * 何を: セルフサインアップの入力を定義する
 * なぜ: 形式チェックは Bean Validation で行い、重複チェックだけをサービス層に残すため
 */
package com.teamplatform.provisioning.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SignupRequest(
    @NotBlank(message = "clubName is required") @Size(max = 120) String clubName,
    @NotBlank(message = "clubSlug is required")
        @Size(min = 3, max = 48, message = "clubSlug must be 3 to 48 characters")
        @Pattern(
            regexp = "^[a-z0-9-]+$",
            message = "clubSlug must be lowercase alphanumeric with hyphens")
        String clubSlug,
    @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
    @NotBlank(message = "plan is required")
        @Pattern(regexp = "^(starter|pro)$", message = "plan must be starter or pro")
        String plan,
    @Pattern(regexp = "^https?://.+", message = "webhookUrl must be an http(s) url") String webhookUrl,
    @Size(min = 16, message = "webhookSecret must be at least 16 characters") String webhookSecret) {

  /** webhookSecret は資格情報なので出力しない。 */
  @Override
  public String toString() {
    return "SignupRequest[clubSlug=" + clubSlug + ", plan=" + plan + "]";
  }
}
