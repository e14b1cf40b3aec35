package com.example.credentialrotator.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.credentialrotator.core.InconsistentSecretException;
import com.example.credentialrotator.core.SecretStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

public class SecretsManagerSecretStoreTest {

  private static final Instant EXPIRY = Instant.parse("2024-05-01T12:00:00Z");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SecretsManagerClient client;
  private SecretsManagerSecretStore store;

  @BeforeEach
  void setUp() {
    client = mock(SecretsManagerClient.class);
    store = new SecretsManagerSecretStore(client);
  }

  @Nested
  @DisplayName("Lookup")
  class Lookup {

    @Test
    @DisplayName("Should map ResourceNotFoundException to empty")
    void shouldReturnEmptyWhenNotFound() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenThrow(ResourceNotFoundException.builder().message("not found").build());

      assertTrue(store.lookup("default", "ai-eg-bsp-p").isEmpty());
    }

    @Test
    @DisplayName("Should read data, annotations and version from the document")
    void shouldReadDocument() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenReturn(
              GetSecretValueResponse.builder()
                  .versionId("v1")
                  .secretString(
                      "{\"annotations\":{\"rotators/expiration-time\":\"2024-05-01T12:00:00Z\"},"
                          + "\"data\":{\"credentials\":\"ini\"}}")
                  .build());

      final var secret = store.lookup("default", "ai-eg-bsp-p").orElseThrow();

      assertEquals("ini", secret.data().get("credentials"));
      assertEquals(EXPIRY, SecretAnnotations.expiration(secret));
      assertEquals("v1", secret.version());
      final var captor = ArgumentCaptor.forClass(GetSecretValueRequest.class);
      verify(client).getSecretValue(captor.capture());
      assertEquals("default/ai-eg-bsp-p", captor.getValue().secretId());
    }

    @Test
    @DisplayName("Should flag a secret that is not a credential document")
    void shouldRejectForeignSecret() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenReturn(GetSecretValueResponse.builder().secretString("not json").build());

      assertThrows(
          InconsistentSecretException.class, () -> store.lookup("default", "ai-eg-bsp-p"));
    }

    @Test
    @DisplayName("Should wrap client failures")
    void shouldWrapClientFailure() {
      when(client.getSecretValue(any(GetSecretValueRequest.class)))
          .thenThrow(SdkClientException.create("connection refused"));

      assertThrows(SecretStoreException.class, () -> store.lookup("default", "ai-eg-bsp-p"));
    }
  }

  @Nested
  @DisplayName("Writes")
  class Writes {

    @Test
    @DisplayName("Should create one document holding data and expiry")
    void shouldCreate() throws Exception {
      when(client.createSecret(any(CreateSecretRequest.class)))
          .thenReturn(CreateSecretResponse.builder().versionId("v1").build());

      final var created = store.create("default", "ai-eg-bsp-p", Map.of("k", "v"), EXPIRY);

      final var captor = ArgumentCaptor.forClass(CreateSecretRequest.class);
      verify(client).createSecret(captor.capture());
      assertEquals("default/ai-eg-bsp-p", captor.getValue().name());
      final var document = MAPPER.readTree(captor.getValue().secretString());
      assertEquals("v", document.path("data").path("k").asText());
      assertEquals(
          "2024-05-01T12:00:00Z",
          document.path("annotations").path("rotators/expiration-time").asText());
      assertEquals("v1", created.version());
    }

    @Test
    @DisplayName("Should put a new value on update")
    void shouldUpdate() throws Exception {
      when(client.putSecretValue(any(PutSecretValueRequest.class)))
          .thenReturn(PutSecretValueResponse.builder().versionId("v2").build());
      final var existing =
          new CredentialSecret(
              "default",
              "ai-eg-bsp-p",
              Map.of("old", "x"),
              Map.of(SecretAnnotations.EXPIRATION_TIME_KEY, "2024-01-01T00:00:00Z"),
              "v1");

      final var updated = store.update(existing, Map.of("new", "y"), EXPIRY);

      final var captor = ArgumentCaptor.forClass(PutSecretValueRequest.class);
      verify(client).putSecretValue(captor.capture());
      final var document = MAPPER.readTree(captor.getValue().secretString());
      assertFalse(document.path("data").has("old"));
      assertEquals("y", document.path("data").path("new").asText());
      assertEquals(EXPIRY, SecretAnnotations.expiration(updated));
      assertEquals("v2", updated.version());
    }
  }
}
