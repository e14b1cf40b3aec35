package com.example.credentialrotator.core.token;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialrotator.core.ConfigurationException;
import com.example.credentialrotator.core.SecretStoreException;
import com.example.credentialrotator.core.secrets.InMemorySecretStore;
import java.util.Map;
import org.junit.jupiter.api.*;

public class ClientSecretResolverTest {

  private InMemorySecretStore store;
  private ClientSecretResolver resolver;

  @BeforeEach
  void setUp() {
    store = new InMemorySecretStore();
    resolver = new ClientSecretResolver(store);
  }

  @Test
  @DisplayName("Should return the client-secret value")
  void shouldResolve() {
    store.put("ns", "creds", Map.of("client-secret", "value"), Map.of());

    assertEquals("value", resolver.resolve("ns", "creds"));
  }

  @Test
  @DisplayName("Should require a namespace")
  void shouldRequireNamespace() {
    assertThrows(ConfigurationException.class, () -> resolver.resolve(null, "creds"));
  }

  @Test
  @DisplayName("Should fail when the secret does not exist")
  void shouldFailWhenMissing() {
    final var e = assertThrows(ConfigurationException.class, () -> resolver.resolve("ns", "x"));

    assertTrue(e.getMessage().contains("ns/x"));
  }

  @Test
  @DisplayName("Should fail when the key is empty")
  void shouldFailOnEmptyValue() {
    store.put("ns", "creds", Map.of("client-secret", ""), Map.of());

    assertThrows(ConfigurationException.class, () -> resolver.resolve("ns", "creds"));
  }

  @Test
  @DisplayName("Should propagate store failures")
  void shouldPropagateStoreFailure() {
    store.failing(true);

    assertThrows(SecretStoreException.class, () -> resolver.resolve("ns", "creds"));
  }
}
