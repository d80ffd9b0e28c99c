package com.teamplatform.provisioning.credential;

import java.time.Instant;

public record IssuedCredential(
    String token, String jti, CredentialAudience audience, Instant issuedAt, Instant expiresAt) {}
