package com.example.credentialrotator.core;

/**
 * Raised when a credential secret exists but its expiration annotation is missing or cannot be
 * parsed. Such a secret must not be used for scheduling.
 */
public class InconsistentSecretException extends CredentialRotationException {

  public InconsistentSecretException(final String message) {
    super(message);
  }

  public InconsistentSecretException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
