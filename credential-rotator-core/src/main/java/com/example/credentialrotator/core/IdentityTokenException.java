package com.example.credentialrotator.core;

/** Raised when the base identity token (OIDC or client credential) cannot be obtained. */
public class IdentityTokenException extends CredentialRotationException {

  public IdentityTokenException(final String message) {
    super(message);
  }

  public IdentityTokenException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
