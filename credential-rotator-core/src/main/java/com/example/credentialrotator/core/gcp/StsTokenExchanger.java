package com.example.credentialrotator.core.gcp;

import com.example.credentialrotator.core.policy.GcpCredentials.WorkloadIdentityFederationConfig;
import com.example.credentialrotator.core.token.TokenExpiry;

/** Exchanges an external identity token for a federated GCP access token. */
@FunctionalInterface
public interface StsTokenExchanger {

  /**
   * Performs the exchange.
   *
   * @param subjectToken external JWT
   * @param federation workload identity pool and provider to exchange against
   * @return federated access token
   * @throws com.example.credentialrotator.core.TokenExchangeException if STS rejects or cannot be
   *     reached
   */
  TokenExpiry exchange(String subjectToken, WorkloadIdentityFederationConfig federation);
}
