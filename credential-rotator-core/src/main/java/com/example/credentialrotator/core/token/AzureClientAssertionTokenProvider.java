package com.example.credentialrotator.core.token;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientAssertionCredentialBuilder;
import com.example.credentialrotator.core.http.ProxySettings;
import java.util.Objects;

/**
 * Azure token provider for workload identity federation: a token from another identity provider is
 * presented as the client assertion.
 */
public class AzureClientAssertionTokenProvider extends AzureCredentialTokenProvider {

  AzureClientAssertionTokenProvider(
      final TokenCredential credential, final String scope, final String clientId) {
    super(credential, scope, clientId);
  }

  /**
   * Creates a provider backed by a {@code ClientAssertionCredential}.
   *
   * @param tenantId directory id
   * @param clientId application id
   * @param assertions source of the federated identity token, queried on each token request
   * @param scope requested scope, {@link #DEFAULT_SCOPE} when {@code null}
   * @param proxies outbound proxies; the Azure target is applied when set
   * @return provider
   */
  public static AzureClientAssertionTokenProvider create(
      final String tenantId,
      final String clientId,
      final TokenProvider assertions,
      final String scope,
      final ProxySettings proxies) {
    AzureClientSecretTokenProvider.requireText(tenantId, "tenant id");
    AzureClientSecretTokenProvider.requireText(clientId, "client id");
    Objects.requireNonNull(assertions, "assertions must not be null");
    final var builder =
        new ClientAssertionCredentialBuilder()
            .tenantId(tenantId)
            .clientId(clientId)
            .clientAssertion(() -> assertions.getToken().token());
    proxyOptions(proxies).ifPresent(builder::proxyOptions);
    return new AzureClientAssertionTokenProvider(builder.build(), scope, clientId);
  }
}
