package com.example.credentialrotator.core;

import static java.lang.System.Logger.Level.INFO;

import com.example.credentialrotator.core.secrets.CredentialSecret;
import com.example.credentialrotator.core.secrets.SecretAnnotations;
import com.example.credentialrotator.core.secrets.SecretStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Helpers shared by all {@link Rotator} implementations. */
public final class Rotators {

  private static final System.Logger logger = System.getLogger(Rotators.class.getName());

  /** Prefix of the secret that holds a policy's rotated credential. */
  public static final String SECRET_NAME_PREFIX = "ai-eg-bsp-";

  private Rotators() {}

  /**
   * Name of the secret holding the rotated credential of a policy.
   *
   * @param policyName policy name
   * @return {@code ai-eg-bsp-<policyName>}
   */
  public static String secretName(final String policyName) {
    return SECRET_NAME_PREFIX + policyName;
  }

  /**
   * Checks whether {@code time} is reached when looking {@code buffer} ahead of now.
   *
   * @param buffer look-ahead; zero compares with the current instant
   * @param time instant to compare with
   * @param clock time source
   * @return true if {@code now + buffer >= time}
   */
  public static boolean isBufferedTimeExpired(
      final Duration buffer, final Instant time, final Clock clock) {
    return !clock.instant().plus(buffer).isBefore(time);
  }

  /**
   * Reads the stored expiry of a secret and subtracts the pre-rotation window.
   *
   * @return the pre-rotation time, or {@link Rotator#ROTATE_IMMEDIATELY} if the secret is absent
   */
  public static Instant preRotationTime(
      final SecretStore store,
      final String namespace,
      final String secretName,
      final Duration preRotationWindow) {
    return store
        .lookup(namespace, secretName)
        .map(SecretAnnotations::expiration)
        .map(expiry -> expiry.minus(preRotationWindow))
        .orElse(Rotator.ROTATE_IMMEDIATELY);
  }

  /**
   * Creates the secret, or replaces payload and expiry of the existing one, in a single write.
   *
   * @return the persisted secret
   */
  public static CredentialSecret upsert(
      final SecretStore store,
      final String namespace,
      final String secretName,
      final Map<String, String> data,
      final Instant expiresAt) {
    return store
        .lookup(namespace, secretName)
        .map(
            existing -> {
              logger.log(INFO, "Updating credential secret {0}/{1}", namespace, secretName);
              return store.update(existing, data, expiresAt);
            })
        .orElseGet(
            () -> {
              logger.log(INFO, "Creating credential secret {0}/{1}", namespace, secretName);
              return store.create(namespace, secretName, data, expiresAt);
            });
  }
}
