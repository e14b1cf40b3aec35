package com.example.credentialrotator.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.credentialrotator.core.policy.CredentialPolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.*;

public class CredentialRotationServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private RotatorFactory factory;
  private Rotator rotator;
  private CredentialPolicy policy;
  private CredentialRotationService service;

  @BeforeEach
  void setUp() {
    factory = mock(RotatorFactory.class);
    rotator = mock(Rotator.class);
    policy = TestPolicies.aws();
    when(factory.settings()).thenReturn(RotatorSettings.defaults());
    when(factory.create(policy)).thenReturn(Optional.of(rotator));
    service = new CredentialRotationService(factory, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Should not requeue a policy with nothing to rotate")
  void shouldIgnoreNonRotatablePolicy() {
    when(factory.create(policy)).thenReturn(Optional.empty());

    final var result = service.reconcile(policy);

    assertTrue(result.succeeded());
    assertTrue(result.requeue().isEmpty());
  }

  @Test
  @DisplayName("Should retry in one minute when the rotator cannot be built")
  void shouldRetryOnSetupFailure() {
    when(factory.create(policy)).thenThrow(new ConfigurationException("bad policy"));

    final var result = service.reconcile(policy);

    assertFalse(result.succeeded());
    assertEquals(Duration.ofMinutes(1), result.requeueAfter());
    assertInstanceOf(ConfigurationException.class, result.failure());
  }

  @Test
  @DisplayName("Should retry in one minute when the rotation time cannot be read")
  void shouldRetryOnLookupFailure() throws Exception {
    when(rotator.getPreRotationTime())
        .thenThrow(new InconsistentSecretException("missing annotation"));

    final var result = service.reconcile(policy);

    assertFalse(result.succeeded());
    assertEquals(Duration.ofMinutes(1), result.requeueAfter());
    verify(rotator, never()).rotate();
    verify(rotator).close();
  }

  @Test
  @DisplayName("Should wait until the pre-rotation time when not yet due")
  void shouldWaitWhenNotDue() throws Exception {
    final var pre = NOW.plus(Duration.ofMinutes(30));
    when(rotator.getPreRotationTime()).thenReturn(pre);
    when(rotator.isExpired(pre)).thenReturn(false);

    final var result = service.reconcile(policy);

    assertTrue(result.succeeded());
    assertEquals(Duration.ofMinutes(30), result.requeueAfter());
    assertEquals(pre.plus(Duration.ofMinutes(5)), result.expiresAt());
    verify(rotator, never()).rotate();
    verify(rotator).close();
  }

  @Test
  @DisplayName("Should rotate when due and requeue before the new expiry")
  void shouldRotateWhenDue() throws Exception {
    when(rotator.getPreRotationTime()).thenReturn(Rotator.ROTATE_IMMEDIATELY);
    when(rotator.isExpired(Rotator.ROTATE_IMMEDIATELY)).thenReturn(true);
    when(rotator.rotate()).thenReturn(NOW.plus(Duration.ofHours(1)));

    final var result = service.reconcile(policy);

    assertTrue(result.succeeded());
    assertEquals(Duration.ofMinutes(55), result.requeueAfter());
    assertEquals(NOW.plus(Duration.ofHours(1)), result.expiresAt());
    verify(rotator).close();
  }

  @Test
  @DisplayName("Should retry in one minute when rotation fails")
  void shouldRetryOnRotationFailure() throws Exception {
    when(rotator.getPreRotationTime()).thenReturn(Rotator.ROTATE_IMMEDIATELY);
    when(rotator.isExpired(Rotator.ROTATE_IMMEDIATELY)).thenReturn(true);
    when(rotator.rotate()).thenThrow(new TokenExchangeException("sts down"));

    final var result = service.reconcile(policy);

    assertFalse(result.succeeded());
    assertEquals(Duration.ofMinutes(1), result.requeueAfter());
    assertInstanceOf(TokenExchangeException.class, result.failure());
    verify(rotator).close();
  }

  @Test
  @DisplayName("Should retry in one minute when the new credential is already inside the window")
  void shouldRetryOnShortLivedCredential() {
    when(rotator.getPreRotationTime()).thenReturn(Rotator.ROTATE_IMMEDIATELY);
    when(rotator.isExpired(Rotator.ROTATE_IMMEDIATELY)).thenReturn(true);
    when(rotator.rotate()).thenReturn(NOW.plus(Duration.ofMinutes(3)));

    final var result = service.reconcile(policy);

    assertTrue(result.succeeded());
    assertEquals(Duration.ofMinutes(1), result.requeueAfter());
    assertEquals(NOW.plus(Duration.ofMinutes(3)), result.expiresAt());
  }
}
