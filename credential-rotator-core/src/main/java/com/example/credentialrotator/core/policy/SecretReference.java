package com.example.credentialrotator.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/**
 * Reference to a secret holding sensitive configuration such as an OIDC client secret.
 *
 * @param name secret name
 * @param namespace secret namespace; the policy namespace is used when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretReference(String name, String namespace) {

  /** Namespace of the reference, falling back to {@code defaultNamespace}. */
  public String namespaceOr(final String defaultNamespace) {
    return Optional.ofNullable(namespace).filter(ns -> !ns.isBlank()).orElse(defaultNamespace);
  }
}
