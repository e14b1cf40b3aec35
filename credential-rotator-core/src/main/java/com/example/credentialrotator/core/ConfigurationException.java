package com.example.credentialrotator.core;

/**
 * Raised when a policy or process setting is missing or malformed. Retrying will not help until
 * the configuration changes.
 */
public class ConfigurationException extends CredentialRotationException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
