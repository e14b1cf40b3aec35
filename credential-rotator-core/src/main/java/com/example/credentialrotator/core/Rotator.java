package com.example.credentialrotator.core;

import java.time.Instant;

/**
 * Keeps one policy's short-lived credential fresh in the secret store.
 *
 * <p>A caller first asks for the pre-rotation time, checks it with {@link #isExpired(Instant)} and,
 * if due, calls {@link #rotate()}. Implementations do not retry; the caller schedules the next
 * attempt.
 */
public interface Rotator extends AutoCloseable {

  /** Pre-rotation time reported when no credential has been stored yet. */
  Instant ROTATE_IMMEDIATELY = Instant.EPOCH;

  /**
   * Whether the given pre-rotation time has been reached. Performs no I/O.
   *
   * @param preRotationTime value from {@link #getPreRotationTime()}
   * @return true once the current time is at or past {@code preRotationTime}
   */
  boolean isExpired(Instant preRotationTime);

  /**
   * Computes when the stored credential should be replaced: its expiry minus the pre-rotation
   * window.
   *
   * @return the pre-rotation time, or {@link #ROTATE_IMMEDIATELY} when nothing is stored
   * @throws InconsistentSecretException if the stored secret lacks a valid expiration annotation
   * @throws SecretStoreException if the store cannot be read
   */
  Instant getPreRotationTime();

  /**
   * Obtains a fresh credential and writes it, with its expiry, to the secret store.
   *
   * <p>The store is only written once the whole exchange chain has succeeded.
   *
   * @return the expiry of the new credential, exactly as recorded in the store
   * @throws CredentialRotationException if any step fails
   */
  Instant rotate();

  /** Releases clients owned by this rotator. */
  @Override
  default void close() {}
}
