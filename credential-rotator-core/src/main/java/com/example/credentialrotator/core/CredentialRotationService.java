package com.example.credentialrotator.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.credentialrotator.core.policy.CredentialPolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs one reconcile pass for a policy: checks whether its credential is due and rotates it if so.
 *
 * <p>The returned {@link RotationResult} tells the caller when to come back. After any failure
 * that is {@link #RETRY_DELAY}; otherwise it is the time left until the credential enters its
 * pre-rotation window.
 */
public class CredentialRotationService {

  private static final System.Logger logger =
      System.getLogger(CredentialRotationService.class.getName());

  /** Delay before retrying a policy whose reconcile failed. */
  public static final Duration RETRY_DELAY = Duration.ofMinutes(1);

  private final RotatorFactory factory;
  private final Clock clock;

  public CredentialRotationService(final RotatorFactory factory) {
    this(factory, Clock.systemUTC());
  }

  public CredentialRotationService(final RotatorFactory factory, final Clock clock) {
    this.factory = Objects.requireNonNull(factory, "factory must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Reconciles a policy.
   *
   * @param policy credential policy
   * @return when to reconcile next, and the outcome
   */
  public RotationResult reconcile(final CredentialPolicy policy) {
    final var window = factory.settings().preRotationWindow();
    logger.log(DEBUG, "Reconciling credential policy {0}/{1}", policy.namespace(), policy.name());

    final Rotator rotator;
    try {
      final var created = factory.create(policy);
      if (created.isEmpty()) {
        logger.log(
            DEBUG,
            "Policy {0}/{1} of type {2} has nothing to rotate",
            policy.namespace(),
            policy.name(),
            policy.type());
        return RotationResult.idle();
      }
      rotator = created.get();
    } catch (final CredentialRotationException e) {
      logger.log(ERROR, "Failed to set up rotator for " + describe(policy), e);
      return RotationResult.failed(RETRY_DELAY, e);
    }

    try (rotator) {
      final Instant preRotationTime;
      try {
        preRotationTime = rotator.getPreRotationTime();
      } catch (final CredentialRotationException e) {
        logger.log(
            ERROR, "Failed to get rotation time, retry in one minute: " + describe(policy), e);
        return RotationResult.failed(RETRY_DELAY, e);
      }

      if (!rotator.isExpired(preRotationTime)) {
        final var requeue = Duration.between(clock.instant(), preRotationTime);
        logger.log(
            INFO,
            "Credentials have not yet expired for {0}, renewing in {1} minutes",
            describe(policy),
            requeue.toMinutes());
        return new RotationResult(requeue, preRotationTime.plus(window), null);
      }

      final Instant expiresAt;
      try {
        expiresAt = rotator.rotate();
      } catch (final CredentialRotationException e) {
        logger.log(
            ERROR, "Failed to rotate credentials, retry in one minute: " + describe(policy), e);
        return RotationResult.failed(RETRY_DELAY, e);
      }

      final var rotationTime = expiresAt.minus(window);
      final var requeue = Duration.between(clock.instant(), rotationTime);
      if (requeue.isNegative() || requeue.isZero()) {
        logger.log(
            ERROR,
            "Newly rotated credential for {0} is already inside its rotation window, rotation time"
                + " {1}",
            describe(policy),
            rotationTime);
        return new RotationResult(RETRY_DELAY, expiresAt, null);
      }
      logger.log(
          INFO,
          "Rotated credentials for {0}, renewing in {1} minutes",
          describe(policy),
          requeue.toMinutes());
      return new RotationResult(requeue, expiresAt, null);
    }
  }

  private static String describe(final CredentialPolicy policy) {
    return String.format("%s/%s (%s)", policy.namespace(), policy.name(), policy.type());
  }
}
