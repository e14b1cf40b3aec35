package com.example.credentialrotator.core.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * A policy describing how the gateway authenticates to one upstream provider.
 *
 * <p>Only the section matching {@link #type()} is consulted.
 */
public record CredentialPolicy(
    String namespace,
    String name,
    ProviderType type,
    AwsCredentials awsCredentials,
    AzureCredentials azureCredentials,
    GcpCredentials gcpCredentials) {

  public CredentialPolicy {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(type, "type must not be null");
  }

  /** Key identifying the policy in logs and schedules: {@code name.namespace}. */
  public String key() {
    return name + "." + namespace;
  }

  public Optional<AwsCredentials> aws() {
    return Optional.ofNullable(awsCredentials);
  }

  public Optional<AzureCredentials> azure() {
    return Optional.ofNullable(azureCredentials);
  }

  public Optional<GcpCredentials> gcp() {
    return Optional.ofNullable(gcpCredentials);
  }
}
