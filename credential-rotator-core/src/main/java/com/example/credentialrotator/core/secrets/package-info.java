/**
 * Durable storage of rotated credentials.
 *
 * <p>{@link com.example.credentialrotator.core.secrets.SecretStore} abstracts the store; {@link
 * com.example.credentialrotator.core.secrets.KubernetesSecretStore} and {@link
 * com.example.credentialrotator.core.secrets.SecretsManagerSecretStore} are the two backends.
 */
package com.example.credentialrotator.core.secrets;
