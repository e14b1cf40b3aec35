package com.example.credentialrotator.core;

import com.example.credentialrotator.core.aws.AwsOidcRotator;
import com.example.credentialrotator.core.azure.AzureTokenRotator;
import com.example.credentialrotator.core.gcp.GcpHttpTransportFactory;
import com.example.credentialrotator.core.gcp.GcpOidcTokenRotator;
import com.example.credentialrotator.core.policy.AwsCredentials;
import com.example.credentialrotator.core.policy.CredentialPolicy;
import com.example.credentialrotator.core.policy.GcpCredentials;
import com.example.credentialrotator.core.secrets.SecretStore;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses and builds the {@link Rotator} for a policy from its provider type.
 *
 * <p>Policies with nothing to rotate yield an empty result: static API keys, AWS policies backed
 * by a credentials file instead of an OIDC exchange, and GCP policies without workload identity
 * federation.
 */
public class RotatorFactory {

  private final SecretStore store;
  private final RotatorSettings settings;
  private final Clock clock;
  private volatile GcpHttpTransportFactory gcpTransport;

  public RotatorFactory(final SecretStore store, final RotatorSettings settings) {
    this(store, settings, Clock.systemUTC());
  }

  public RotatorFactory(
      final SecretStore store, final RotatorSettings settings, final Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public RotatorSettings settings() {
    return settings;
  }

  /**
   * Builds the rotator for a policy.
   *
   * @param policy credential policy
   * @return the rotator, or empty when the policy holds no rotatable credential
   * @throws ConfigurationException if the policy section for its type is incomplete
   */
  public Optional<Rotator> create(final CredentialPolicy policy) {
    if (!policy.type().rotatable()) {
      return Optional.empty();
    }
    switch (policy.type()) {
      case AWS_CREDENTIALS:
        if (policy.aws().flatMap(AwsCredentials::oidcExchange).isEmpty()) {
          return Optional.empty();
        }
        return Optional.of(
            AwsOidcRotator.builder()
                .policy(policy)
                .store(store)
                .settings(settings)
                .clock(clock)
                .build());
      case AZURE_CREDENTIALS:
        return Optional.of(
            AzureTokenRotator.builder()
                .policy(policy)
                .store(store)
                .settings(settings)
                .clock(clock)
                .build());
      case GCP_CREDENTIALS:
        if (policy.gcp().isPresent()
            && policy.gcp().flatMap(GcpCredentials::federation).isEmpty()) {
          return Optional.empty();
        }
        return Optional.of(
            GcpOidcTokenRotator.builder()
                .policy(policy)
                .store(store)
                .settings(settings)
                .clock(clock)
                .transportFactory(gcpTransport())
                .build());
      default:
        return Optional.empty();
    }
  }

  private GcpHttpTransportFactory gcpTransport() {
    final var current = gcpTransport;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (gcpTransport == null) {
        gcpTransport = GcpHttpTransportFactory.create(settings.proxies());
      }
      return gcpTransport;
    }
  }
}
