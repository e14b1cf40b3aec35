package com.example.credentialrotator.core;

/** Raised when a provider-side exchange (AWS STS, GCP STS, impersonation) fails. */
public class TokenExchangeException extends CredentialRotationException {

  public TokenExchangeException(final String message) {
    super(message);
  }

  public TokenExchangeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
