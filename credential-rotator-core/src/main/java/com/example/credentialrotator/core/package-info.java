/**
 * Credential rotation for an AI gateway.
 *
 * <p>A {@link com.example.credentialrotator.core.Rotator} exchanges a locally issued identity
 * token for short-lived provider credentials and keeps them in a {@link
 * com.example.credentialrotator.core.secrets.SecretStore}, annotated with their expiry. {@link
 * com.example.credentialrotator.core.RotatorFactory} picks the rotator for a policy, {@link
 * com.example.credentialrotator.core.CredentialRotationService} runs one reconcile pass, and
 * {@link com.example.credentialrotator.core.RotationScheduler} repeats it for every policy.
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * try (var client = new KubernetesClientBuilder().build()) {
 *   var store = new KubernetesSecretStore(client);
 *   var factory = new RotatorFactory(store, RotatorSettings.fromEnvironment());
 *   var result = new CredentialRotationService(factory).reconcile(policy);
 *   result.requeue().ifPresent(delay -> ...);
 * }
 * }</pre>
 *
 * <p>All failures are unchecked and extend {@link
 * com.example.credentialrotator.core.CredentialRotationException}.
 */
package com.example.credentialrotator.core;
