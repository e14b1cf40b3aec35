package com.example.credentialrotator.core.aws;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialrotator.core.AbstractCredentialRotator;
import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.RotatorSettings;
import com.example.credentialrotator.core.TokenExchangeException;
import com.example.credentialrotator.core.http.ProxySettings;
import com.example.credentialrotator.core.policy.CredentialPolicy;
import com.example.credentialrotator.core.secrets.SecretStore;
import com.example.credentialrotator.core.token.ClientSecretResolver;
import com.example.credentialrotator.core.token.OidcTokenProvider;
import com.example.credentialrotator.core.token.TokenProvider;
import java.time.Clock;
import java.util.Map;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.http.apache.ProxyConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityResponse;

/**
 * Rotates AWS session credentials obtained with {@code AssumeRoleWithWebIdentity}.
 *
 * <p>An OIDC token from the policy's identity provider is exchanged at STS for temporary
 * credentials of the configured role. The credentials are stored as a shared credentials file
 * under the {@value #CREDENTIALS_KEY} key.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (var rotator = AwsOidcRotator.builder()
 *     .policy(policy)
 *     .store(store)
 *     .settings(RotatorSettings.fromEnvironment())
 *     .build()) {
 *   if (rotator.isExpired(rotator.getPreRotationTime())) {
 *     rotator.rotate();
 *   }
 * }
 * }</pre>
 */
public class AwsOidcRotator extends AbstractCredentialRotator {

  private static final System.Logger logger = System.getLogger(AwsOidcRotator.class.getName());

  /** Secret key holding the rendered credentials file. */
  public static final String CREDENTIALS_KEY = "credentials";

  static final String SESSION_NAME_PREFIX = "ai-gateway-";
  static final int MAX_SESSION_NAME_LENGTH = 64;

  private final String roleArn;
  private final String region;
  private final TokenProvider tokenProvider;
  private final StsClient stsClient;
  private final boolean ownsStsClient;

  private AwsOidcRotator(final Builder builder) {
    super(
        builder.store,
        builder.policy.namespace(),
        builder.policy.name(),
        builder.settings.preRotationWindow(),
        builder.clock);
    this.roleArn = builder.roleArn;
    this.region = builder.region;
    this.tokenProvider = builder.tokenProvider;
    this.stsClient = builder.stsClient;
    this.ownsStsClient = builder.ownsStsClient;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected IssuedCredential issue() {
    final var token = tokenProvider.getToken();
    final var request =
        AssumeRoleWithWebIdentityRequest.builder()
            .roleArn(roleArn)
            .webIdentityToken(token.token())
            .roleSessionName(sessionName(policyName))
            .build();
    final AssumeRoleWithWebIdentityResponse response;
    try {
      response = stsClient.assumeRoleWithWebIdentity(request);
    } catch (final SdkException e) {
      throw new TokenExchangeException(
          String.format(
              "Failed to assume role %s for policy %s/%s", roleArn, namespace, policyName),
          e);
    }
    final var credentials = response.credentials();
    if (credentials == null) {
      throw new TokenExchangeException(
          String.format(
              "STS returned no credentials for role %s (policy %s/%s)",
              roleArn, namespace, policyName));
    }
    logger.log(
        DEBUG, "Assumed role {0}, credentials expire at {1}", roleArn, credentials.expiration());
    final var file =
        new AwsCredentialsFile(
            AwsCredentialsFile.DEFAULT_PROFILE,
            credentials.accessKeyId(),
            credentials.secretAccessKey(),
            credentials.sessionToken(),
            region);
    return new IssuedCredential(Map.of(CREDENTIALS_KEY, file.render()), credentials.expiration());
  }

  @Override
  protected String provider() {
    return "AWS";
  }

  @Override
  public void close() {
    if (ownsStsClient) {
      stsClient.close();
    }
  }

  /** STS role session name for a policy, capped at the STS limit. */
  static String sessionName(final String policyName) {
    final var name = SESSION_NAME_PREFIX + policyName;
    return name.length() > MAX_SESSION_NAME_LENGTH
        ? name.substring(0, MAX_SESSION_NAME_LENGTH)
        : name;
  }

  /**
   * Builds an STS client for web identity calls: anonymous credentials, the policy region and the
   * STS proxy when one is configured.
   */
  static StsClient defaultStsClient(final String region, final ProxySettings proxies) {
    final var builder =
        StsClient.builder()
            .region(Region.of(region))
            .credentialsProvider(AnonymousCredentialsProvider.create());
    proxies
        .proxyUri(ProxySettings.Target.STS)
        .ifPresent(
            uri ->
                builder.httpClientBuilder(
                    ApacheHttpClient.builder()
                        .proxyConfiguration(ProxyConfiguration.builder().endpoint(uri).build())));
    return builder.build();
  }

  /** Builder for {@link AwsOidcRotator}. */
  public static class Builder {
    private CredentialPolicy policy;
    private SecretStore store;
    private RotatorSettings settings = RotatorSettings.defaults();
    private Clock clock = Clock.systemUTC();
    private TokenProvider tokenProvider;
    private StsClient stsClient;
    private String roleArn;
    private String region;
    private boolean ownsStsClient;

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

    /** Uses the given STS client; the rotator will not close it. */
    public Builder stsClient(final StsClient stsClient) {
      this.stsClient = stsClient;
      return this;
    }

    /**
     * Validates the policy and builds the rotator.
     *
     * @throws IllegalStateException if policy, store or settings are missing
     * @throws ConfigurationException if the policy has no usable AWS OIDC exchange configuration
     */
    public AwsOidcRotator build() {
      if (policy == null) {
        throw new IllegalStateException("policy must be set");
      }
      if (store == null) {
        throw new IllegalStateException("store must be set");
      }
      if (settings == null) {
        throw new IllegalStateException("settings must be set");
      }
      final var aws =
          policy
              .aws()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "AWS credentials are not configured in policy %s/%s",
                              policy.namespace(), policy.name())));
      final var exchange =
          aws.oidcExchange()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "AWS OIDC exchange token is not configured in policy %s/%s",
                              policy.namespace(), policy.name())));
      roleArn = requireText(exchange.awsRoleArn(), "awsRoleArn");
      region = requireText(aws.region(), "region");
      if (tokenProvider == null) {
        tokenProvider =
            OidcTokenProvider.builder()
                .config(exchange.oidc())
                .clientSecrets(new ClientSecretResolver(store))
                .clock(clock)
                .build();
      }
      if (stsClient == null) {
        stsClient = defaultStsClient(region, settings.proxies());
        ownsStsClient = true;
      }
      return new AwsOidcRotator(this);
    }

    private String requireText(final String value, final String field) {
      if (value == null || value.isBlank()) {
        throw new ConfigurationException(
            String.format(
                "AWS %s is not set in policy %s/%s", field, policy.namespace(), policy.name()));
      }
      return value;
    }
  }
}
