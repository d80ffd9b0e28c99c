package com.teamplatform.provisioning.credential;

import java.util.Locale;
import java.util.Optional;

/** Authorization ヘッダから Bearer トークンを取り出す。 */
public final class BearerTokens {

  private static final String PREFIX = "bearer ";

  private BearerTokens() {}

  public static Optional<String> extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      return Optional.empty();
    }
    final String trimmed = authorizationHeader.trim();
    if (trimmed.length() <= PREFIX.length()
        || !trimmed.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)) {
      return Optional.empty();
    }
    final String token = trimmed.substring(PREFIX.length()).trim();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
