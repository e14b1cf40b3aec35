package com.example.credentialrotator.core.token;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.http.ProxySettings;

/** Azure token provider authenticating with tenant, client id and client secret. */
public class AzureClientSecretTokenProvider extends AzureCredentialTokenProvider {

  AzureClientSecretTokenProvider(
      final TokenCredential credential, final String scope, final String clientId) {
    super(credential, scope, clientId);
  }

  /**
   * Creates a provider backed by a {@code ClientSecretCredential}.
   *
   * @param tenantId directory id
   * @param clientId application id
   * @param clientSecret client secret
   * @param scope requested scope, {@link #DEFAULT_SCOPE} when {@code null}
   * @param proxies outbound proxies; the Azure target is applied when set
   * @return provider
   * @throws ConfigurationException if any identifier or the secret is empty
   */
  public static AzureClientSecretTokenProvider create(
      final String tenantId,
      final String clientId,
      final String clientSecret,
      final String scope,
      final ProxySettings proxies) {
    requireText(tenantId, "tenant id");
    requireText(clientId, "client id");
    requireText(clientSecret, "client secret");
    final var builder =
        new ClientSecretCredentialBuilder()
            .tenantId(tenantId)
            .clientId(clientId)
            .clientSecret(clientSecret);
    proxyOptions(proxies).ifPresent(builder::proxyOptions);
    return new AzureClientSecretTokenProvider(builder.build(), scope, clientId);
  }

  static void requireText(final String value, final String what) {
    if (value == null || value.isBlank()) {
      throw new ConfigurationException("Azure " + what + " must not be empty");
    }
  }
}
