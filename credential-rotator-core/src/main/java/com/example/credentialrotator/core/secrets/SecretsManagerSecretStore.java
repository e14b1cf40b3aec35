package com.example.credentialrotator.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialrotator.core.InconsistentSecretException;
import com.example.credentialrotator.core.SecretStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * {@link SecretStore} backed by AWS Secrets Manager.
 *
 * <p>Each credential secret maps to the Secrets Manager secret {@code {namespace}/{name}} whose
 * secret string is a single JSON document:
 *
 * <pre>{@code
 * {"annotations": {"rotators/expiration-time": "2024-01-01T00:00:00Z"}, "data": {...}}
 * }</pre>
 *
 * so payload and expiration always change together in one {@code PutSecretValue} call.
 *
 * <p>{@link #fromEnvironment()} configures the client from system properties or environment
 * variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 */
public class SecretsManagerSecretStore implements SecretStore {

  private static final System.Logger logger =
      System.getLogger(SecretsManagerSecretStore.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final SecretsManagerClient client;

  public SecretsManagerSecretStore(final SecretsManagerClient client) {
    this.client = Objects.requireNonNull(client, "client must not be null");
  }

  /**
   * Creates a store whose client honours region, endpoint and credentials overrides.
   *
   * @return configured store
   */
  public static SecretsManagerSecretStore fromEnvironment() {
    final var builder = SecretsManagerClient.builder();

    builder.region(
        Optional.ofNullable(System.getProperty("aws.region"))
            .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
            .map(Region::of)
            .orElse(Region.US_EAST_1));

    Optional.ofNullable(System.getProperty("aws.sm.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")))
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    Optional.ofNullable(System.getProperty("aws.accessKeyId", System.getenv("AWS_ACCESS_KEY_ID")))
        .flatMap(
            accessKey ->
                Optional.ofNullable(
                        System.getProperty(
                            "aws.secretAccessKey", System.getenv("AWS_SECRET_ACCESS_KEY")))
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.builder().build()));

    return new SecretsManagerSecretStore(builder.build());
  }

  /**
   * Secrets Manager identifier of a credential secret.
   *
   * @param namespace secret namespace
   * @param name secret name
   * @return {@code namespace/name}
   */
  public static String secretId(final String namespace, final String name) {
    return namespace + "/" + name;
  }

  @Override
  public Optional<CredentialSecret> lookup(final String namespace, final String name) {
    final var secretId = secretId(namespace, name);
    try {
      final var response =
          client.getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build());
      final var document = read(secretId, response.secretString());
      return Optional.of(
          new CredentialSecret(
              namespace, name, document.data(), document.annotations(), response.versionId()));
    } catch (final ResourceNotFoundException e) {
      return Optional.empty();
    } catch (final SdkException e) {
      throw new SecretStoreException("Failed to get secret " + secretId, e);
    }
  }

  @Override
  public CredentialSecret create(
      final String namespace,
      final String name,
      final Map<String, String> data,
      final Instant expiresAt) {
    final var secretId = secretId(namespace, name);
    final var annotations = SecretAnnotations.withExpiration(null, expiresAt);
    try {
      final var response =
          client.createSecret(
              CreateSecretRequest.builder()
                  .name(secretId)
                  .secretString(write(secretId, new SecretDocument(annotations, data)))
                  .build());
      logger.log(DEBUG, "Created Secrets Manager secret {0}", secretId);
      return new CredentialSecret(namespace, name, data, annotations, response.versionId());
    } catch (final SdkException e) {
      throw new SecretStoreException("Failed to create secret " + secretId, e);
    }
  }

  @Override
  public CredentialSecret update(
      final CredentialSecret existing, final Map<String, String> data, final Instant expiresAt) {
    final var secretId = secretId(existing.namespace(), existing.name());
    final var annotations = SecretAnnotations.withExpiration(existing.annotations(), expiresAt);
    try {
      final var response =
          client.putSecretValue(
              PutSecretValueRequest.builder()
                  .secretId(secretId)
                  .secretString(write(secretId, new SecretDocument(annotations, data)))
                  .build());
      logger.log(DEBUG, "Put new value for Secrets Manager secret {0}", secretId);
      return new CredentialSecret(
          existing.namespace(), existing.name(), data, annotations, response.versionId());
    } catch (final SdkException e) {
      throw new SecretStoreException("Failed to update secret " + secretId, e);
    }
  }

  private static SecretDocument read(final String secretId, final String secretString) {
    if (secretString == null || secretString.isBlank()) {
      throw new InconsistentSecretException("secret " + secretId + " has no secret string");
    }
    try {
      return MAPPER.readValue(secretString, SecretDocument.class);
    } catch (final JsonProcessingException e) {
      throw new InconsistentSecretException(
          "secret " + secretId + " does not hold a credential document", e);
    }
  }

  private static String write(final String secretId, final SecretDocument document) {
    try {
      return MAPPER.writeValueAsString(document);
    } catch (final JsonProcessingException e) {
      throw new SecretStoreException("Failed to serialize secret " + secretId, e);
    }
  }

  /** Wire shape of the secret string. */
  record SecretDocument(Map<String, String> annotations, Map<String, String> data) {
    SecretDocument {
      annotations = annotations == null ? Map.of() : annotations;
      data = data == null ? Map.of() : data;
    }
  }
}
