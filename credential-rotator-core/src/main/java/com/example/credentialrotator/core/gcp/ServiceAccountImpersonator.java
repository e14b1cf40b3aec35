package com.example.credentialrotator.core.gcp;

import com.example.credentialrotator.core.token.TokenExpiry;

/** Mints an access token for a service account using a caller token allowed to impersonate it. */
@FunctionalInterface
public interface ServiceAccountImpersonator {

  /**
   * @param bearerToken token of the impersonating principal
   * @param serviceAccountEmail target service account
   * @return access token of the service account
   * @throws com.example.credentialrotator.core.TokenExchangeException on failure
   */
  TokenExpiry impersonate(String bearerToken, String serviceAccountEmail);
}
