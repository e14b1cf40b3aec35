package com.example.credentialrotator.core.secrets;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Contract of the durable store holding credential secrets, keyed by namespace and name.
 *
 * <p>Every write replaces the whole payload map and the expiration annotation in a single store
 * call; implementations never issue partial updates. Lookup-then-create is not transactional: two
 * concurrent first rotations of the same policy may both observe an absent secret, in which case
 * one of the creates fails.
 */
public interface SecretStore {

  /**
   * Looks up a secret.
   *
   * @param namespace secret namespace
   * @param name secret name
   * @return the secret, or empty when it does not exist
   * @throws com.example.credentialrotator.core.SecretStoreException for any failure other than
   *     "not found"
   */
  Optional<CredentialSecret> lookup(String namespace, String name);

  /**
   * Creates a new secret holding the given payload and expiration.
   *
   * @param namespace secret namespace
   * @param name secret name
   * @param data full payload
   * @param expiresAt expiration of the credential in {@code data}
   * @return the persisted secret
   */
  CredentialSecret create(
      String namespace, String name, Map<String, String> data, Instant expiresAt);

  /**
   * Replaces payload and expiration of an existing secret in one write.
   *
   * @param existing secret as previously returned by {@link #lookup}
   * @param data full replacement payload
   * @param expiresAt expiration of the credential in {@code data}
   * @return the persisted secret
   */
  CredentialSecret update(CredentialSecret existing, Map<String, String> data, Instant expiresAt);
}
