package com.example.credentialrotator.core.token;

/**
 * Source of a bearer token with known expiry.
 *
 * <p>Implementations block the calling thread and must honour interruption.
 */
@FunctionalInterface
public interface TokenProvider {

  /**
   * Obtains a fresh token.
   *
   * @return token and its expiration
   * @throws com.example.credentialrotator.core.CredentialRotationException if no token could be
   *     obtained
   */
  TokenExpiry getToken();
}
