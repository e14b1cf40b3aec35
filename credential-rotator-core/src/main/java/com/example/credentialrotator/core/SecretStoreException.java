package com.example.credentialrotator.core;

/** Raised when a lookup, create or update against the secret store fails. */
public class SecretStoreException extends CredentialRotationException {

  public SecretStoreException(final String message) {
    super(message);
  }

  public SecretStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
