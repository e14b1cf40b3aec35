package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OIDC client configuration used to obtain the base identity token.
 *
 * @param provider identity provider endpoints
 * @param clientId OAuth2 client id
 * @param clientSecret reference to the secret holding the client secret under {@code
 *     client-secret}
 * @param scopes scopes requested in addition to the provider's advertised ones
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OidcConfig(
    Provider provider,
    @JsonProperty("clientID") String clientId,
    SecretReference clientSecret,
    List<String> scopes) {

  public OidcConfig {
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
  }

  /**
   * Identity provider endpoints.
   *
   * @param issuer issuer URL, the discovery document lives below it
   * @param tokenEndpoint optional override of the discovered token endpoint
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Provider(String issuer, String tokenEndpoint) {}
}
