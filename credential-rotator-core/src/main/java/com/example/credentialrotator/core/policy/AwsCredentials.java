package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/**
 * AWS section of a credential policy.
 *
 * @param region AWS region written into the credentials file and used for STS
 * @param oidcExchangeToken web identity configuration; absent for static credential files
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AwsCredentials(String region, AwsOidcExchangeToken oidcExchangeToken) {

  public Optional<AwsOidcExchangeToken> oidcExchange() {
    return Optional.ofNullable(oidcExchangeToken);
  }

  /**
   * OIDC token source plus the role assumed with it.
   *
   * @param oidc OIDC client configuration
   * @param awsRoleArn role to assume with web identity
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AwsOidcExchangeToken(OidcConfig oidc, String awsRoleArn) {}
}
