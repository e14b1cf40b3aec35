package com.example.credentialrotator.core.token;

import java.time.Instant;
import java.util.Objects;

/**
 * A bearer token and the instant it stops being valid.
 *
 * @param token opaque token value
 * @param expiresAt expiration instant
 */
public record TokenExpiry(String token, Instant expiresAt) {

  public TokenExpiry {
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(expiresAt, "expiresAt must not be null");
  }

  @Override
  public String toString() {
    return "TokenExpiry[token=***, expiresAt=" + expiresAt + "]";
  }
}
