package com.example.credentialrotator.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.credentialrotator.core.secrets.InMemorySecretStore;
import com.example.credentialrotator.core.secrets.SecretAnnotations;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.*;

public class RotatorsTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  @DisplayName("Should prefix the policy name")
  void shouldNameSecret() {
    assertEquals("ai-eg-bsp-my-policy", Rotators.secretName("my-policy"));
  }

  @Nested
  @DisplayName("Buffered expiry")
  class BufferedExpiry {

    @Test
    @DisplayName("Should treat a time equal to now as expired")
    void shouldExpireAtBoundary() {
      assertTrue(Rotators.isBufferedTimeExpired(Duration.ZERO, NOW, CLOCK));
    }

    @Test
    @DisplayName("Should not expire a future time")
    void shouldNotExpireFutureTime() {
      assertFalse(Rotators.isBufferedTimeExpired(Duration.ZERO, NOW.plusSeconds(1), CLOCK));
    }

    @Test
    @DisplayName("Should look ahead by the buffer")
    void shouldApplyBuffer() {
      final var inFiveMinutes = NOW.plus(Duration.ofMinutes(5));
      assertTrue(Rotators.isBufferedTimeExpired(Duration.ofMinutes(5), inFiveMinutes, CLOCK));
      assertFalse(Rotators.isBufferedTimeExpired(Duration.ofMinutes(4), inFiveMinutes, CLOCK));
    }
  }

  @Nested
  @DisplayName("Secret helpers")
  class SecretHelpers {

    private InMemorySecretStore store;

    @BeforeEach
    void setUp() {
      store = new InMemorySecretStore();
    }

    @Test
    @DisplayName("Should rotate immediately when the secret is absent")
    void shouldRotateImmediatelyWithoutSecret() {
      assertEquals(
          Rotator.ROTATE_IMMEDIATELY,
          Rotators.preRotationTime(store, "default", "ai-eg-bsp-p", Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Should subtract the window from the stored expiry")
    void shouldSubtractWindow() {
      store.put(
          "default",
          "ai-eg-bsp-p",
          Map.of("k", "v"),
          Map.of(SecretAnnotations.EXPIRATION_TIME_KEY, "2024-05-01T13:00:00Z"));

      assertEquals(
          Instant.parse("2024-05-01T12:55:00Z"),
          Rotators.preRotationTime(store, "default", "ai-eg-bsp-p", Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Should fail on a secret without expiry annotation")
    void shouldFailWithoutAnnotation() {
      store.put("default", "ai-eg-bsp-p", Map.of("k", "v"), Map.of());

      assertThrows(
          InconsistentSecretException.class,
          () -> Rotators.preRotationTime(store, "default", "ai-eg-bsp-p", Duration.ZERO));
    }

    @Test
    @DisplayName("Should create then update in place")
    void shouldUpsert() {
      final var expiry = NOW.plus(Duration.ofHours(1));

      Rotators.upsert(store, "default", "ai-eg-bsp-p", Map.of("k", "1"), expiry);
      Rotators.upsert(store, "default", "ai-eg-bsp-p", Map.of("k", "2"), expiry.plusSeconds(60));

      assertEquals(1, store.creates.get());
      assertEquals(1, store.updates.get());
      final var secret = store.get("default", "ai-eg-bsp-p").orElseThrow();
      assertEquals("2", secret.data().get("k"));
      assertEquals(expiry.plusSeconds(60), SecretAnnotations.expiration(secret));
    }
  }
}
