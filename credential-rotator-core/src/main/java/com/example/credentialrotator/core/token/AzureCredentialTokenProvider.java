package com.example.credentialrotator.core.token;

import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.core.exception.AzureException;
import com.azure.core.http.ProxyOptions;
import com.example.credentialrotator.core.IdentityTokenException;
import com.example.credentialrotator.core.http.ProxySettings;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/** Base for providers that obtain Microsoft Entra ID access tokens through azure-identity. */
public abstract class AzureCredentialTokenProvider implements TokenProvider {

  /** Scope requested when none is given: Azure OpenAI / Cognitive Services. */
  public static final String DEFAULT_SCOPE = "https://cognitiveservices.azure.com/.default";

  private final TokenCredential credential;
  private final TokenRequestContext requestContext;
  private final String clientId;

  protected AzureCredentialTokenProvider(
      final TokenCredential credential, final String scope, final String clientId) {
    this.credential = Objects.requireNonNull(credential, "credential must not be null");
    this.requestContext =
        new TokenRequestContext().addScopes(Optional.ofNullable(scope).orElse(DEFAULT_SCOPE));
    this.clientId = clientId;
  }

  @Override
  public TokenExpiry getToken() {
    try {
      final var token = credential.getTokenSync(requestContext);
      if (token == null) {
        throw new IdentityTokenException("Azure returned no token for client " + clientId);
      }
      return new TokenExpiry(token.getToken(), token.getExpiresAt().toInstant());
    } catch (final AzureException | UncheckedIOException e) {
      throw new IdentityTokenException("Failed to get Azure token for client " + clientId, e);
    }
  }

  /** Proxy options for the Azure proxy target, if one is configured. */
  static Optional<ProxyOptions> proxyOptions(final ProxySettings proxies) {
    return proxies
        .proxyUri(ProxySettings.Target.AZURE)
        .map(
            uri ->
                new ProxyOptions(
                    ProxyOptions.Type.HTTP,
                    InetSocketAddress.createUnresolved(uri.getHost(), ProxySettings.port(uri))));
  }
}
