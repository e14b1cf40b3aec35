package com.example.credentialrotator.core.secrets;

import java.util.Map;
import java.util.Optional;

/**
 * Durable record holding the credential currently in use for one policy.
 *
 * <p>The data map carries the provider-specific payload; the annotations carry the expiration time
 * under {@link SecretAnnotations#EXPIRATION_TIME_KEY}. Both are always written together.
 *
 * @param namespace namespace of the owning policy
 * @param name secret name derived from the policy name
 * @param data provider-specific payload keys and values
 * @param annotations metadata, including the expiration annotation
 * @param version store-specific version marker of this copy (resource version, version id); may be
 *     {@code null} for records not yet persisted
 */
public record CredentialSecret(
    String namespace,
    String name,
    Map<String, String> data,
    Map<String, String> annotations,
    String version) {

  public CredentialSecret {
    data = data == null ? Map.of() : Map.copyOf(data);
    annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
  }

  /**
   * Returns the value stored under the given data key.
   *
   * @param key payload key
   * @return value if present
   */
  public Optional<String> value(final String key) {
    return Optional.ofNullable(data.get(key));
  }
}
