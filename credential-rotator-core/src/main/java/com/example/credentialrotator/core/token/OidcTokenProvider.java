package com.example.credentialrotator.core.token;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.IdentityTokenException;
import com.example.credentialrotator.core.policy.OidcConfig;
import com.example.credentialrotator.core.policy.SecretReference;
import com.nimbusds.oauth2.sdk.ClientCredentialsGrant;
import com.nimbusds.oauth2.sdk.GeneralException;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.TokenRequest;
import com.nimbusds.oauth2.sdk.TokenResponse;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.Issuer;
import com.nimbusds.oauth2.sdk.token.AccessToken;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Obtains access tokens from an OpenID Connect provider with the OAuth2 client credentials grant.
 *
 * <p>On first use the provider metadata is resolved from {@code
 * {issuer}/.well-known/openid-configuration}. Its {@code token_endpoint} is used unless the
 * configuration names one explicitly, and its {@code scopes_supported} are appended to the
 * configured scopes. Every {@link #getToken()} call then reads the client secret from the secret
 * store and posts the grant, authenticating with HTTP Basic.
 *
 * <p>Discovery and the grant share a fixed budget of {@link #REQUEST_BUDGET}, regardless of any
 * deadline the caller may have.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var provider = OidcTokenProvider.builder()
 *     .config(policyOidcConfig)
 *     .clientSecrets(new ClientSecretResolver(store))
 *     .build();
 * TokenExpiry token = provider.getToken();
 * }</pre>
 */
public class OidcTokenProvider implements TokenProvider {

  private static final System.Logger logger =
      System.getLogger(OidcTokenProvider.class.getName());

  /** Overall time allowed for discovery plus token request. */
  public static final Duration REQUEST_BUDGET = Duration.ofMinutes(1);

  private final OidcConfig config;
  private final ClientSecretResolver clientSecrets;
  private final Clock clock;

  private volatile Endpoint endpoint;

  private OidcTokenProvider(final Builder builder) {
    this.config = builder.config;
    this.clientSecrets = builder.clientSecrets;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public TokenExpiry getToken() {
    final var deadline = clock.instant().plus(REQUEST_BUDGET);
    final var resolved = endpoint(deadline);
    final var secretRef = config.clientSecret();
    final var clientSecret =
        clientSecrets.resolve(
            Optional.ofNullable(secretRef).map(SecretReference::namespace).orElse(null),
            Optional.ofNullable(secretRef).map(SecretReference::name).orElse(null));

    final var request =
        new TokenRequest(
            resolved.tokenEndpoint(),
            new ClientSecretBasic(new ClientID(config.clientId()), new Secret(clientSecret)),
            new ClientCredentialsGrant(),
            resolved.scope().isEmpty() ? null : resolved.scope());
    final var httpRequest = request.toHTTPRequest();
    final var timeout = remainingMillis(deadline);
    httpRequest.setConnectTimeout(timeout);
    httpRequest.setReadTimeout(timeout);

    final TokenResponse response;
    try {
      response = TokenResponse.parse(httpRequest.send());
    } catch (final IOException | ParseException e) {
      throw new IdentityTokenException("Failed OIDC token request for issuer " + issuer(), e);
    }
    if (!response.indicatesSuccess()) {
      final var error = response.toErrorResponse().getErrorObject();
      throw new IdentityTokenException(
          String.format(
              "OIDC token request for issuer %s failed with HTTP %d: %s",
              issuer(), error.getHTTPStatusCode(), error.getCode()));
    }
    final var success = response.toSuccessResponse();
    final var accessToken = success.getTokens().getAccessToken();
    final var expiresAt = expiry(accessToken, success.getCustomParameters());
    logger.log(DEBUG, "Obtained OIDC token from {0} expiring at {1}", issuer(), expiresAt);
    return new TokenExpiry(accessToken.getValue(), expiresAt);
  }

  /** Discovered or configured endpoint and merged scopes; discovery runs once. */
  Endpoint endpoint(final Instant deadline) {
    final var current = endpoint;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (endpoint == null) {
        endpoint = discover(deadline);
      }
      return endpoint;
    }
  }

  private Endpoint discover(final Instant deadline) {
    final var issuer = issuer();
    final var timeout = remainingMillis(deadline);
    final OIDCProviderMetadata metadata;
    try {
      metadata = OIDCProviderMetadata.resolve(new Issuer(issuer), timeout, timeout);
    } catch (final GeneralException e) {
      throw new ConfigurationException(
          "Invalid oidc provider config for issuer " + issuer + ": " + e.getMessage(), e);
    } catch (final IOException e) {
      throw new IdentityTokenException("Failed OIDC discovery for issuer " + issuer, e);
    }
    if (metadata.getTokenEndpointURI() == null) {
      throw new ConfigurationException(
          "token_endpoint is required in oidc provider config: " + issuer);
    }

    final var tokenEndpoint =
        Optional.ofNullable(config.provider().tokenEndpoint())
            .filter(value -> !value.isBlank())
            .map(OidcTokenProvider::toUri)
            .orElse(metadata.getTokenEndpointURI());

    final var scopes = new LinkedHashSet<>(config.scopes());
    Optional.ofNullable(metadata.getScopes())
        .ifPresent(supported -> supported.forEach(value -> scopes.add(value.getValue())));

    logger.log(DEBUG, "Discovered token endpoint {0} for issuer {1}", tokenEndpoint, issuer);
    return new Endpoint(tokenEndpoint, new Scope(scopes.toArray(new String[0])));
  }

  private Instant expiry(final AccessToken token, final Map<String, Object> custom) {
    if (token.getLifetime() > 0) {
      return clock.instant().plusSeconds(token.getLifetime());
    }
    final var expiresAt = custom.get("expires_at");
    if (expiresAt instanceof Number && ((Number) expiresAt).longValue() > 0) {
      return Instant.ofEpochSecond(((Number) expiresAt).longValue());
    }
    throw new IdentityTokenException("token response carries no expiry: " + issuer());
  }

  private int remainingMillis(final Instant deadline) {
    final var left = Duration.between(clock.instant(), deadline);
    if (left.isNegative() || left.isZero()) {
      throw new IdentityTokenException("OIDC request budget exhausted for issuer " + issuer());
    }
    return (int) left.toMillis();
  }

  private String issuer() {
    return config.provider().issuer();
  }

  private static URI toUri(final String value) {
    try {
      return new URI(value);
    } catch (final URISyntaxException e) {
      throw new ConfigurationException("invalid oidc token endpoint: " + value, e);
    }
  }

  record Endpoint(URI tokenEndpoint, Scope scope) {}

  /** Builder for {@link OidcTokenProvider}. */
  public static class Builder {
    private OidcConfig config;
    private ClientSecretResolver clientSecrets;
    private Clock clock = Clock.systemUTC();

    public Builder config(final OidcConfig config) {
      this.config = config;
      return this;
    }

    public Builder clientSecrets(final ClientSecretResolver clientSecrets) {
      this.clientSecrets = clientSecrets;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the provider.
     *
     * @throws ConfigurationException if the OIDC configuration lacks an issuer or client id
     * @throws IllegalStateException if the client secret resolver is not set
     */
    public OidcTokenProvider build() {
      if (config == null) {
        throw new ConfigurationException("oidc config must be set");
      }
      if (config.provider() == null
          || config.provider().issuer() == null
          || config.provider().issuer().isBlank()) {
        throw new ConfigurationException("oidc provider issuer is required");
      }
      if (config.clientId() == null || config.clientId().isBlank()) {
        throw new ConfigurationException(
            "oidc client id is required for issuer " + config.provider().issuer());
      }
      if (clientSecrets == null) {
        throw new IllegalStateException("clientSecrets must be set");
      }
      Objects.requireNonNull(clock, "clock must not be null");
      return new OidcTokenProvider(this);
    }
  }
}
