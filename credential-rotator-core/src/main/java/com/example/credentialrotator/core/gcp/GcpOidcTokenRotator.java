package com.example.credentialrotator.core.gcp;

import static java.lang.System.Logger.Level.INFO;

import com.example.credentialrotator.core.AbstractCredentialRotator;
import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.RotatorSettings;
import com.example.credentialrotator.core.policy.CredentialPolicy;
import com.example.credentialrotator.core.policy.GcpCredentials;
import com.example.credentialrotator.core.policy.GcpCredentials.WorkloadIdentityFederationConfig;
import com.example.credentialrotator.core.secrets.SecretStore;
import com.example.credentialrotator.core.token.ClientSecretResolver;
import com.example.credentialrotator.core.token.OidcTokenProvider;
import com.example.credentialrotator.core.token.TokenProvider;
import java.time.Clock;
import java.util.Map;

/**
 * Rotates GCP access tokens obtained through workload identity federation.
 *
 * <p>The chain has up to three hops:
 *
 * <ol>
 *   <li>an OIDC token from the policy's identity provider,
 *   <li>a token exchange at the Google STS against the configured workload identity provider,
 *   <li>optionally, impersonation of the service account {@code
 *       <serviceAccountName>@<projectName>.iam.gserviceaccount.com} using the STS token as bearer.
 * </ol>
 *
 * Without impersonation the STS token is the stored credential. The secret holds {@value
 * #ACCESS_TOKEN_KEY}, {@value #PROJECT_NAME_KEY} and {@value #REGION_KEY}.
 */
public class GcpOidcTokenRotator extends AbstractCredentialRotator {

  private static final System.Logger logger =
      System.getLogger(GcpOidcTokenRotator.class.getName());

  public static final String ACCESS_TOKEN_KEY = "gcpAccessToken";
  public static final String PROJECT_NAME_KEY = "projectName";
  public static final String REGION_KEY = "region";

  private final GcpCredentials credentials;
  private final WorkloadIdentityFederationConfig federation;
  private final TokenProvider tokenProvider;
  private final StsTokenExchanger stsTokenExchanger;
  private final ServiceAccountImpersonator impersonator;

  private GcpOidcTokenRotator(final Builder builder) {
    super(
        builder.store,
        builder.policy.namespace(),
        builder.policy.name(),
        builder.settings.preRotationWindow(),
        builder.clock);
    this.credentials = builder.credentials;
    this.federation = builder.federation;
    this.tokenProvider = builder.tokenProvider;
    this.stsTokenExchanger = builder.stsTokenExchanger;
    this.impersonator = builder.impersonator;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected IssuedCredential issue() {
    final var oidcToken = tokenProvider.getToken();
    final var stsToken = stsTokenExchanger.exchange(oidcToken.token(), federation);
    final var accessToken =
        federation
            .impersonation()
            .map(
                sa -> {
                  final var email = sa.email(credentials.projectName());
                  logger.log(INFO, "Impersonating service account {0}", email);
                  return impersonator.impersonate(stsToken.token(), email);
                })
            .orElse(stsToken);
    return new IssuedCredential(
        Map.of(
            ACCESS_TOKEN_KEY, accessToken.token(),
            PROJECT_NAME_KEY, nullToEmpty(credentials.projectName()),
            REGION_KEY, nullToEmpty(credentials.region())),
        accessToken.expiresAt());
  }

  @Override
  protected String provider() {
    return "GCP";
  }

  private static String nullToEmpty(final String value) {
    return value == null ? "" : value;
  }

  /** Builder for {@link GcpOidcTokenRotator}. */
  public static class Builder {
    private CredentialPolicy policy;
    private SecretStore store;
    private RotatorSettings settings = RotatorSettings.defaults();
    private Clock clock = Clock.systemUTC();
    private TokenProvider tokenProvider;
    private StsTokenExchanger stsTokenExchanger;
    private ServiceAccountImpersonator impersonator;
    private GcpHttpTransportFactory transportFactory;
    private GcpCredentials credentials;
    private WorkloadIdentityFederationConfig federation;

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

    /** Overrides the OIDC token source built from the policy. */
    public Builder tokenProvider(final TokenProvider tokenProvider) {
      this.tokenProvider = tokenProvider;
      return this;
    }

    public Builder stsTokenExchanger(final StsTokenExchanger stsTokenExchanger) {
      this.stsTokenExchanger = stsTokenExchanger;
      return this;
    }

    public Builder impersonator(final ServiceAccountImpersonator impersonator) {
      this.impersonator = impersonator;
      return this;
    }

    /** Shares one transport across rotators; built from the settings when not given. */
    public Builder transportFactory(final GcpHttpTransportFactory transportFactory) {
      this.transportFactory = transportFactory;
      return this;
    }

    /**
     * Builds the rotator.
     *
     * @throws IllegalStateException if policy, store or settings are missing
     * @throws ConfigurationException if GCP credentials or the federation config are missing, or a
     *     field needed to build the STS audience or service account email is blank
     */
    public GcpOidcTokenRotator build() {
      if (policy == null) {
        throw new IllegalStateException("policy must be set");
      }
      if (store == null) {
        throw new IllegalStateException("store must be set");
      }
      if (settings == null) {
        throw new IllegalStateException("settings must be set");
      }
      credentials =
          policy
              .gcp()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "GCP credentials are not configured in policy %s/%s",
                              policy.namespace(), policy.name())));
      federation =
          credentials
              .federation()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "GCP workload identity federation is not configured in policy %s/%s",
                              policy.namespace(), policy.name())));
      requireText(federation.projectId(), "projectID");
      requireText(federation.workloadIdentityPoolName(), "workloadIdentityPoolName");
      requireText(federation.workloadIdentityProviderName(), "workloadIdentityProviderName");
      federation
          .impersonation()
          .ifPresent(
              sa -> {
                requireText(sa.serviceAccountName(), "serviceAccountName");
                requireText(credentials.projectName(), "projectName");
              });
      if (tokenProvider == null) {
        if (federation.oidcExchangeToken() == null) {
          throw new ConfigurationException(
              String.format(
                  "GCP OIDC exchange token is not configured in policy %s/%s",
                  policy.namespace(), policy.name()));
        }
        tokenProvider =
            OidcTokenProvider.builder()
                .config(federation.oidcExchangeToken().oidc())
                .clientSecrets(new ClientSecretResolver(store))
                .clock(clock)
                .build();
      }
      if (stsTokenExchanger == null || impersonator == null) {
        final var transport =
            transportFactory != null
                ? transportFactory
                : GcpHttpTransportFactory.create(settings.proxies());
        if (stsTokenExchanger == null) {
          stsTokenExchanger = new GoogleStsTokenExchanger(transport);
        }
        if (impersonator == null) {
          impersonator = new GoogleServiceAccountImpersonator(transport);
        }
      }
      return new GcpOidcTokenRotator(this);
    }

    private void requireText(final String value, final String field) {
      if (value == null || value.isBlank()) {
        throw new ConfigurationException(
            String.format(
                "GCP %s is not set in policy %s/%s", field, policy.namespace(), policy.name()));
      }
    }
  }
}
