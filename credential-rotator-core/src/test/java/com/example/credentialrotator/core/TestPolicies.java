package com.example.credentialrotator.core;

import com.example.credentialrotator.core.policy.AwsCredentials;
import com.example.credentialrotator.core.policy.AwsCredentials.AwsOidcExchangeToken;
import com.example.credentialrotator.core.policy.AzureCredentials;
import com.example.credentialrotator.core.policy.CredentialPolicy;
import com.example.credentialrotator.core.policy.GcpCredentials;
import com.example.credentialrotator.core.policy.GcpCredentials.ServiceAccountImpersonation;
import com.example.credentialrotator.core.policy.GcpCredentials.WorkloadIdentityFederationConfig;
import com.example.credentialrotator.core.policy.OidcConfig;
import com.example.credentialrotator.core.policy.OidcExchangeToken;
import com.example.credentialrotator.core.policy.ProviderType;
import com.example.credentialrotator.core.policy.SecretReference;
import java.util.List;

/** Policies shared by rotator tests. */
public final class TestPolicies {

  public static final String NAMESPACE = "default";
  public static final String NAME = "my-policy";
  public static final String ROLE_ARN = "arn:aws:iam::123456789012:role/gateway";

  private TestPolicies() {}

  public static OidcConfig oidc(final String issuer) {
    return new OidcConfig(
        new OidcConfig.Provider(issuer, null),
        "gateway-client",
        new SecretReference("oidc-client", NAMESPACE),
        List.of("openid"));
  }

  public static CredentialPolicy aws() {
    return new CredentialPolicy(
        NAMESPACE,
        NAME,
        ProviderType.AWS_CREDENTIALS,
        new AwsCredentials(
            "us-east-1",
            new AwsOidcExchangeToken(oidc("https://issuer.example.com"), ROLE_ARN)),
        null,
        null);
  }

  public static CredentialPolicy azureWithSecret() {
    return new CredentialPolicy(
        NAMESPACE,
        NAME,
        ProviderType.AZURE_CREDENTIALS,
        null,
        new AzureCredentials(
            "client-id", "tenant-id", new SecretReference("azure-client", null), null),
        null);
  }

  public static CredentialPolicy azureWithOidc() {
    return new CredentialPolicy(
        NAMESPACE,
        NAME,
        ProviderType.AZURE_CREDENTIALS,
        null,
        new AzureCredentials(
            "client-id",
            "tenant-id",
            null,
            new OidcExchangeToken(oidc("https://issuer.example.com"))),
        null);
  }

  public static CredentialPolicy gcp(final ServiceAccountImpersonation impersonation) {
    return new CredentialPolicy(
        NAMESPACE,
        NAME,
        ProviderType.GCP_CREDENTIALS,
        null,
        null,
        new GcpCredentials(
            "my-project",
            "us-central1",
            new WorkloadIdentityFederationConfig(
                "123456",
                "my-pool",
                "my-provider",
                new OidcExchangeToken(oidc("https://issuer.example.com")),
                impersonation)));
  }
}
