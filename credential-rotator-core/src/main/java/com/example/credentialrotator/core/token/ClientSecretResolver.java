package com.example.credentialrotator.core.token;

import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.secrets.SecretStore;
import java.util.Objects;

/** Reads OAuth2 client secrets kept in the secret store under {@value #CLIENT_SECRET_KEY}. */
public class ClientSecretResolver {

  public static final String CLIENT_SECRET_KEY = "client-secret";

  private final SecretStore store;

  public ClientSecretResolver(final SecretStore store) {
    this.store = Objects.requireNonNull(store, "store must not be null");
  }

  /**
   * Resolves a client secret.
   *
   * @param namespace secret namespace
   * @param name secret name
   * @return the non-empty client secret
   * @throws ConfigurationException if the reference is incomplete, the secret is missing, or it
   *     holds no value under the client secret key
   */
  public String resolve(final String namespace, final String name) {
    if (namespace == null || namespace.isBlank()) {
      throw new ConfigurationException("client secret namespace is not set for secret " + name);
    }
    if (name == null || name.isBlank()) {
      throw new ConfigurationException("client secret name is not set in namespace " + namespace);
    }
    final var secret =
        store
            .lookup(namespace, name)
            .orElseThrow(
                () ->
                    new ConfigurationException(
                        String.format("client secret %s/%s does not exist", namespace, name)));
    return secret
        .value(CLIENT_SECRET_KEY)
        .filter(value -> !value.isEmpty())
        .orElseThrow(
            () ->
                new ConfigurationException(
                    String.format(
                        "missing %s in secret %s/%s", CLIENT_SECRET_KEY, namespace, name)));
  }
}
