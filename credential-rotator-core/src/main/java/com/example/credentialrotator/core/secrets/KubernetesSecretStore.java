package com.example.credentialrotator.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialrotator.core.SecretStoreException;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SecretStore} backed by Kubernetes {@code Opaque} secrets.
 *
 * <p>Payload values are stored base64 encoded in the secret's {@code data} section; the expiration
 * is stored as a metadata annotation. Updates edit the live object and carry the resource version
 * observed at lookup, so a concurrent writer makes the update fail with a conflict rather than
 * being overwritten.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (var client = new KubernetesClientBuilder().build()) {
 *   SecretStore store = new KubernetesSecretStore(client);
 *   store.lookup("default", "ai-eg-bsp-my-policy").ifPresent(...);
 * }
 * }</pre>
 */
public class KubernetesSecretStore implements SecretStore {

  private static final System.Logger logger =
      System.getLogger(KubernetesSecretStore.class.getName());

  static final String SECRET_TYPE = "Opaque";

  private final KubernetesClient client;

  public KubernetesSecretStore(final KubernetesClient client) {
    this.client = Objects.requireNonNull(client, "client must not be null");
  }

  @Override
  public Optional<CredentialSecret> lookup(final String namespace, final String name) {
    try {
      return Optional.ofNullable(client.secrets().inNamespace(namespace).withName(name).get())
          .map(KubernetesSecretStore::toCredentialSecret);
    } catch (final KubernetesClientException e) {
      throw new SecretStoreException(
          String.format("Failed to get secret %s/%s", namespace, name), e);
    }
  }

  @Override
  public CredentialSecret create(
      final String namespace,
      final String name,
      final Map<String, String> data,
      final Instant expiresAt) {
    final var secret =
        new SecretBuilder()
            .withNewMetadata()
            .withNamespace(namespace)
            .withName(name)
            .withAnnotations(SecretAnnotations.withExpiration(null, expiresAt))
            .endMetadata()
            .withType(SECRET_TYPE)
            .withData(encode(data))
            .build();
    try {
      final var created = client.secrets().inNamespace(namespace).resource(secret).create();
      logger.log(DEBUG, "Created Kubernetes secret {0}/{1}", namespace, name);
      return toCredentialSecret(created);
    } catch (final KubernetesClientException e) {
      throw new SecretStoreException(
          String.format("Failed to create secret %s/%s", namespace, name), e);
    }
  }

  @Override
  public CredentialSecret update(
      final CredentialSecret existing, final Map<String, String> data, final Instant expiresAt) {
    try {
      final var current =
          client.secrets().inNamespace(existing.namespace()).withName(existing.name()).get();
      if (current == null) {
        throw new SecretStoreException(
            String.format(
                "Failed to update secret %s/%s: not found", existing.namespace(), existing.name()));
      }
      // edit the live object so labels, owner references and other fields survive
      final var annotations =
          SecretAnnotations.withExpiration(current.getMetadata().getAnnotations(), expiresAt);
      final var secret =
          new SecretBuilder(current)
              .editMetadata()
              .withResourceVersion(existing.version())
              .withAnnotations(annotations)
              .endMetadata()
              .withData(encode(data))
              .withStringData(null)
              .build();
      final var updated =
          client.secrets().inNamespace(existing.namespace()).resource(secret).update();
      logger.log(DEBUG, "Updated Kubernetes secret {0}/{1}", existing.namespace(), existing.name());
      return toCredentialSecret(updated);
    } catch (final KubernetesClientException e) {
      throw new SecretStoreException(
          String.format(
              "Failed to update secret %s/%s (HTTP %d)",
              existing.namespace(), existing.name(), e.getCode()),
          e);
    }
  }

  private static CredentialSecret toCredentialSecret(final Secret secret) {
    final var metadata = secret.getMetadata();
    return new CredentialSecret(
        metadata.getNamespace(),
        metadata.getName(),
        decode(secret),
        metadata.getAnnotations(),
        metadata.getResourceVersion());
  }

  private static Map<String, String> encode(final Map<String, String> data) {
    final var encoded = new HashMap<String, String>();
    data.forEach(
        (key, value) ->
            encoded.put(
                key,
                Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8))));
    return encoded;
  }

  private static Map<String, String> decode(final Secret secret) {
    final var decoded = new HashMap<String, String>();
    Optional.ofNullable(secret.getData())
        .ifPresent(
            data ->
                data.forEach(
                    (key, value) ->
                        decoded.put(
                            key,
                            new String(
                                Base64.getDecoder().decode(value), StandardCharsets.UTF_8))));
    // stringData is only set on objects that never went through the API server
    Optional.ofNullable(secret.getStringData()).ifPresent(decoded::putAll);
    return decoded;
  }
}
