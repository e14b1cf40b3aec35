package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Azure section of a credential policy. Exactly one of {@code clientSecretRef} and {@code
 * oidcExchangeToken} is expected.
 *
 * @param clientId application (client) id
 * @param tenantId directory (tenant) id
 * @param clientSecretRef secret holding the client secret under {@code client-secret}
 * @param oidcExchangeToken federated identity token source used as client assertion
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AzureCredentials(
    @JsonProperty("clientID") String clientId,
    @JsonProperty("tenantID") String tenantId,
    SecretReference clientSecretRef,
    OidcExchangeToken oidcExchangeToken) {

  public Optional<SecretReference> clientSecret() {
    return Optional.ofNullable(clientSecretRef);
  }

  public Optional<OidcExchangeToken> oidcExchange() {
    return Optional.ofNullable(oidcExchangeToken);
  }
}
