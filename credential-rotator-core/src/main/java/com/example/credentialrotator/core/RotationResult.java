package com.example.credentialrotator.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of one reconcile pass over a policy.
 *
 * @param requeueAfter delay until the policy should be reconciled again; {@code null} if never
 * @param expiresAt expiry of the credential in the store after this pass, if known
 * @param failure error that ended the pass, {@code null} on success
 */
public record RotationResult(
    Duration requeueAfter, Instant expiresAt, CredentialRotationException failure) {

  /** Result for a policy with nothing to rotate. */
  public static RotationResult idle() {
    return new RotationResult(null, null, null);
  }

  public static RotationResult failed(
      final Duration requeueAfter, final CredentialRotationException failure) {
    return new RotationResult(requeueAfter, null, failure);
  }

  public boolean succeeded() {
    return failure == null;
  }

  public Optional<Duration> requeue() {
    return Optional.ofNullable(requeueAfter);
  }

  public Optional<Instant> expiry() {
    return Optional.ofNullable(expiresAt);
  }
}
