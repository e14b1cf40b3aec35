package com.example.credentialrotator.core;

import com.example.credentialrotator.core.http.ProxySettings;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-wide rotation settings, read once at startup and passed explicitly to rotators.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>ai.gateway.pre.rotation.window / AI_GATEWAY_PRE_ROTATION_WINDOW (ISO-8601 duration, default
 *       PT5M)
 *   <li>the proxy variables documented on {@link ProxySettings}
 * </ul>
 *
 * @param preRotationWindow how long before expiry a credential is replaced
 * @param proxies outbound proxy configuration
 */
public record RotatorSettings(Duration preRotationWindow, ProxySettings proxies) {

  public static final Duration DEFAULT_PRE_ROTATION_WINDOW = Duration.ofMinutes(5);

  public RotatorSettings {
    Objects.requireNonNull(preRotationWindow, "preRotationWindow must not be null");
    Objects.requireNonNull(proxies, "proxies must not be null");
    if (preRotationWindow.isNegative()) {
      throw new IllegalArgumentException("preRotationWindow must not be negative");
    }
  }

  /** Default window, no proxies. */
  public static RotatorSettings defaults() {
    return new RotatorSettings(DEFAULT_PRE_ROTATION_WINDOW, ProxySettings.none());
  }

  /** Reads settings from system properties and environment variables. */
  public static RotatorSettings fromEnvironment() {
    final var window =
        Optional.ofNullable(System.getProperty("ai.gateway.pre.rotation.window"))
            .or(() -> Optional.ofNullable(System.getenv("AI_GATEWAY_PRE_ROTATION_WINDOW")))
            .filter(val -> !val.isBlank())
            .map(String::trim)
            .map(RotatorSettings::parseWindow)
            .orElse(DEFAULT_PRE_ROTATION_WINDOW);
    return new RotatorSettings(window, ProxySettings.fromEnvironment());
  }

  private static Duration parseWindow(final String raw) {
    try {
      return Duration.parse(raw);
    } catch (final DateTimeParseException e) {
      throw new ConfigurationException("invalid pre-rotation window: " + raw, e);
    }
  }
}
