package com.example.credentialrotator.core;

/**
 * Base type of every failure raised while computing the rotation schedule or rotating a credential.
 *
 * <p>Subclasses classify the failure so callers can decide whether a retry on the next scheduling
 * cycle makes sense. Nothing in this library retries on its own.
 */
public class CredentialRotationException extends RuntimeException {

  public CredentialRotationException(final String message) {
    super(message);
  }

  public CredentialRotationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
