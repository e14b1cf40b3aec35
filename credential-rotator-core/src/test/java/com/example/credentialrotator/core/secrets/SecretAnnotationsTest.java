package com.example.credentialrotator.core.secrets;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialrotator.core.InconsistentSecretException;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.*;

public class SecretAnnotationsTest {

  @Test
  @DisplayName("Should format as RFC 3339 UTC with second precision")
  void shouldFormat() {
    assertEquals(
        "2024-05-01T10:00:00Z",
        SecretAnnotations.format(Instant.parse("2024-05-01T10:00:00.987Z")));
  }

  @Test
  @DisplayName("Should keep unrelated annotations")
  void shouldKeepOtherAnnotations() {
    final var annotations =
        SecretAnnotations.withExpiration(
            Map.of("owner", "gateway"), Instant.parse("2024-05-01T10:00:00Z"));

    assertEquals("gateway", annotations.get("owner"));
    assertEquals("2024-05-01T10:00:00Z", annotations.get(SecretAnnotations.EXPIRATION_TIME_KEY));
  }

  @Test
  @DisplayName("Should read an offset timestamp")
  void shouldParseOffset() {
    final var secret =
        new CredentialSecret(
            "ns",
            "s",
            Map.of(),
            Map.of(SecretAnnotations.EXPIRATION_TIME_KEY, "2024-05-01T12:00:00+02:00"),
            "1");

    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), SecretAnnotations.expiration(secret));
  }

  @Test
  @DisplayName("Should fail when the annotation is missing")
  void shouldFailWhenMissing() {
    final var secret = new CredentialSecret("ns", "s", Map.of(), Map.of(), "1");

    final var e =
        assertThrows(InconsistentSecretException.class, () -> SecretAnnotations.expiration(secret));
    assertTrue(e.getMessage().contains("ns/s"));
  }

  @Test
  @DisplayName("Should fail when the annotation cannot be parsed")
  void shouldFailWhenUnparsable() {
    final var secret =
        new CredentialSecret(
            "ns", "s", Map.of(), Map.of(SecretAnnotations.EXPIRATION_TIME_KEY, "tomorrow"), "1");

    assertThrows(InconsistentSecretException.class, () -> SecretAnnotations.expiration(secret));
  }
}
