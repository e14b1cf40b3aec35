package com.example.credentialrotator.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.credentialrotator.core.Rotators;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
public class SecretsManagerSecretStoreLocalstackTest {

  private static final Instant FIRST_EXPIRY = Instant.parse("2024-05-01T12:00:00Z");
  private static final Instant SECOND_EXPIRY = Instant.parse("2024-05-01T13:00:00Z");

  private GenericContainer<?> localstack;
  private SecretsManagerSecretStore store;

  @BeforeAll
  void setup() {
    assumeTrue(dockerAvailable(), "Docker not available, skipping test");

    localstack =
        new GenericContainer<>(DockerImageName.parse("localstack/localstack:3"))
            .withExposedPorts(4566)
            .withEnv("SERVICES", "secretsmanager");
    localstack.start();

    System.setProperty(
        "aws.sm.endpoint",
        "http://%s:%d".formatted(localstack.getHost(), localstack.getMappedPort(4566)));
    System.setProperty("aws.region", "us-east-1");
    System.setProperty("aws.accessKeyId", "test");
    System.setProperty("aws.secretAccessKey", "test");
    store = SecretsManagerSecretStore.fromEnvironment();
  }

  @AfterAll
  void cleanup() {
    if (localstack != null) localstack.stop();

    System.clearProperty("aws.sm.endpoint");
    System.clearProperty("aws.region");
    System.clearProperty("aws.accessKeyId");
    System.clearProperty("aws.secretAccessKey");
  }

  @Test
  void shouldReportMissingSecretAsEmpty() {
    assertTrue(store.lookup("default", "ai-eg-bsp-absent").isEmpty());
  }

  @Test
  void shouldCreateThenUpdateThroughUpsert() {
    final var name = Rotators.secretName("it-policy");

    Rotators.upsert(store, "default", name, Map.of("azureAccessToken", "first"), FIRST_EXPIRY);
    final var created = store.lookup("default", name).orElseThrow();
    assertEquals("first", created.data().get("azureAccessToken"));
    assertEquals(FIRST_EXPIRY, SecretAnnotations.expiration(created));

    Rotators.upsert(store, "default", name, Map.of("azureAccessToken", "second"), SECOND_EXPIRY);
    final var updated = store.lookup("default", name).orElseThrow();
    assertEquals("second", updated.data().get("azureAccessToken"));
    assertEquals(SECOND_EXPIRY, SecretAnnotations.expiration(updated));
    assertNotEquals(created.version(), updated.version(), "Version should change after update");
  }

  private boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }
}
