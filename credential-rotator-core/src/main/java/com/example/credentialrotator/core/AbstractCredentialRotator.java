package com.example.credentialrotator.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.credentialrotator.core.secrets.SecretStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Base for rotators that store their credential in the secret {@code ai-eg-bsp-<policy>}.
 *
 * <p>Subclasses only implement {@link #issue()}, the provider-specific exchange chain. Persisting
 * the result is done here, after {@code issue()} returned, so a failing chain never touches the
 * store.
 */
public abstract class AbstractCredentialRotator implements Rotator {

  private static final System.Logger logger =
      System.getLogger(AbstractCredentialRotator.class.getName());

  protected final SecretStore store;
  protected final String namespace;
  protected final String policyName;
  protected final Duration preRotationWindow;
  protected final Clock clock;

  protected AbstractCredentialRotator(
      final SecretStore store,
      final String namespace,
      final String policyName,
      final Duration preRotationWindow,
      final Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
    this.policyName = Objects.requireNonNull(policyName, "policyName must not be null");
    this.preRotationWindow =
        Objects.requireNonNull(preRotationWindow, "preRotationWindow must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public boolean isExpired(final Instant preRotationTime) {
    return Rotators.isBufferedTimeExpired(Duration.ZERO, preRotationTime, clock);
  }

  @Override
  public Instant getPreRotationTime() {
    return Rotators.preRotationTime(store, namespace, secretName(), preRotationWindow);
  }

  @Override
  public Instant rotate() {
    logger.log(INFO, "Rotating {0} credentials for {1}/{2}", provider(), namespace, policyName);
    final IssuedCredential credential;
    try {
      credential = issue();
    } catch (final CredentialRotationException e) {
      logger.log(
          ERROR,
          String.format(
              "Failed to obtain %s credentials for %s/%s", provider(), namespace, policyName),
          e);
      throw e;
    }
    final var expiresAt = credential.expiresAt().truncatedTo(ChronoUnit.SECONDS);
    Rotators.upsert(store, namespace, secretName(), credential.data(), expiresAt);
    logger.log(
        INFO,
        "Stored {0} credentials for {1}/{2}, expiring at {3}",
        provider(),
        namespace,
        policyName,
        expiresAt);
    return expiresAt;
  }

  /** Name of the secret holding this policy's credential. */
  public String secretName() {
    return Rotators.secretName(policyName);
  }

  /**
   * Runs the provider exchange chain.
   *
   * @return payload to store and its expiry
   * @throws CredentialRotationException if any step of the chain fails
   */
  protected abstract IssuedCredential issue();

  /** Short provider label used in log lines. */
  protected abstract String provider();

  /**
   * A freshly obtained credential.
   *
   * @param data payload keys and values to store
   * @param expiresAt credential expiry
   */
  protected record IssuedCredential(Map<String, String> data, Instant expiresAt) {
    public IssuedCredential {
      data = Map.copyOf(data);
      Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }
  }
}
