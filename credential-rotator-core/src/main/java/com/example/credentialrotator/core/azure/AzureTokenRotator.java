package com.example.credentialrotator.core.azure;

import com.example.credentialrotator.core.AbstractCredentialRotator;
import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.RotatorSettings;
import com.example.credentialrotator.core.policy.AzureCredentials;
import com.example.credentialrotator.core.policy.CredentialPolicy;
import com.example.credentialrotator.core.secrets.SecretStore;
import com.example.credentialrotator.core.token.AzureClientAssertionTokenProvider;
import com.example.credentialrotator.core.token.AzureClientSecretTokenProvider;
import com.example.credentialrotator.core.token.ClientSecretResolver;
import com.example.credentialrotator.core.token.OidcTokenProvider;
import com.example.credentialrotator.core.token.TokenProvider;
import java.time.Clock;
import java.util.Map;

/**
 * Rotates Microsoft Entra ID access tokens for Azure OpenAI.
 *
 * <p>The token comes either from a client secret credential or, for workload identity federation,
 * from a client assertion credential fed by the policy's OIDC provider. It is stored under {@value
 * #ACCESS_TOKEN_KEY}.
 */
public class AzureTokenRotator extends AbstractCredentialRotator {

  /** Secret key holding the access token. */
  public static final String ACCESS_TOKEN_KEY = "azureAccessToken";

  private final TokenProvider tokenProvider;

  private AzureTokenRotator(final Builder builder) {
    super(
        builder.store,
        builder.policy.namespace(),
        builder.policy.name(),
        builder.settings.preRotationWindow(),
        builder.clock);
    this.tokenProvider = builder.tokenProvider;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected IssuedCredential issue() {
    final var token = tokenProvider.getToken();
    return new IssuedCredential(Map.of(ACCESS_TOKEN_KEY, token.token()), token.expiresAt());
  }

  @Override
  protected String provider() {
    return "Azure";
  }

  /** Builder for {@link AzureTokenRotator}. */
  public static class Builder {
    private CredentialPolicy policy;
    private SecretStore store;
    private RotatorSettings settings = RotatorSettings.defaults();
    private Clock clock = Clock.systemUTC();
    private TokenProvider tokenProvider;

    public Builder policy(final CredentialPolicy policy) {
      this.policy = policy;
      return this;
    }

    public Builder store(final SecretStore store) {
      this.store = store;
      return this;
    }

    public Builder settings(final RotatorSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Overrides the Azure token source built from the policy. */
    public Builder tokenProvider(final TokenProvider tokenProvider) {
      this.tokenProvider = tokenProvider;
      return this;
    }

    /**
     * Builds the rotator. Without an explicit token provider, the client secret is read from the
     * store at this point.
     *
     * @throws IllegalStateException if policy, store or settings are missing
     * @throws ConfigurationException if the policy has no Azure section or neither a client secret
     *     nor an OIDC exchange is configured
     */
    public AzureTokenRotator build() {
      if (policy == null) {
        throw new IllegalStateException("policy must be set");
      }
      if (store == null) {
        throw new IllegalStateException("store must be set");
      }
      if (settings == null) {
        throw new IllegalStateException("settings must be set");
      }
      final var azure =
          policy
              .azure()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "Azure credentials are not configured in policy %s/%s",
                              policy.namespace(), policy.name())));
      if (tokenProvider == null) {
        tokenProvider = defaultTokenProvider(azure);
      }
      return new AzureTokenRotator(this);
    }

    private TokenProvider defaultTokenProvider(final AzureCredentials azure) {
      final var resolver = new ClientSecretResolver(store);
      if (azure.clientSecret().isPresent()) {
        final var ref = azure.clientSecret().get();
        return AzureClientSecretTokenProvider.create(
            azure.tenantId(),
            azure.clientId(),
            resolver.resolve(ref.namespaceOr(policy.namespace()), ref.name()),
            null,
            settings.proxies());
      }
      return azure
          .oidcExchange()
          .map(
              exchange ->
                  (TokenProvider)
                      AzureClientAssertionTokenProvider.create(
                          azure.tenantId(),
                          azure.clientId(),
                          OidcTokenProvider.builder()
                              .config(exchange.oidc())
                              .clientSecrets(resolver)
                              .clock(clock)
                              .build(),
                          null,
                          settings.proxies()))
          .orElseThrow(
              () ->
                  new ConfigurationException(
                      String.format(
                          "Azure policy %s/%s needs clientSecretRef or oidcExchangeToken",
                          policy.namespace(), policy.name())));
    }
  }
}
