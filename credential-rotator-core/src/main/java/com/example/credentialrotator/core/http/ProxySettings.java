package com.example.credentialrotator.core.http;

import com.example.credentialrotator.core.ConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-provider outbound proxy configuration.
 *
 * <p>Each target is read from a system property first, then from the environment:
 *
 * <ul>
 *   <li>ai.gateway.gcp.auth.proxy.url / AI_GATEWAY_GCP_AUTH_PROXY_URL
 *   <li>ai.gateway.azure.proxy.url / AI_GATEWAY_AZURE_PROXY_URL
 *   <li>ai.gateway.sts.proxy.url / AI_GATEWAY_STS_PROXY_URL
 * </ul>
 *
 * A value that is set but not a valid absolute URL fails when the proxy is resolved, never
 * silently falls back to a direct connection.
 */
public final class ProxySettings {

  /** Outbound traffic classes that can be proxied independently. */
  public enum Target {
    GCP_AUTH("ai.gateway.gcp.auth.proxy.url", "AI_GATEWAY_GCP_AUTH_PROXY_URL"),
    AZURE("ai.gateway.azure.proxy.url", "AI_GATEWAY_AZURE_PROXY_URL"),
    STS("ai.gateway.sts.proxy.url", "AI_GATEWAY_STS_PROXY_URL");

    private final String property;
    private final String envVar;

    Target(final String property, final String envVar) {
      this.property = property;
      this.envVar = envVar;
    }

    public String property() {
      return property;
    }

    public String envVar() {
      return envVar;
    }
  }

  private static final ProxySettings NONE = new ProxySettings(Map.of());

  private final Map<Target, String> urls;

  private ProxySettings(final Map<Target, String> urls) {
    this.urls = urls.isEmpty() ? Map.of() : new EnumMap<>(urls);
  }

  /** Settings with no proxy for any target. */
  public static ProxySettings none() {
    return NONE;
  }

  /**
   * Settings from explicit raw values.
   *
   * @param urls raw proxy URL per target
   * @return settings
   */
  public static ProxySettings of(final Map<Target, String> urls) {
    return new ProxySettings(urls);
  }

  /** Reads every target from system properties and environment variables. */
  public static ProxySettings fromEnvironment() {
    final var urls = new EnumMap<Target, String>(Target.class);
    for (final var target : Target.values()) {
      Optional.ofNullable(System.getProperty(target.property()))
          .or(() -> Optional.ofNullable(System.getenv(target.envVar())))
          .filter(val -> !val.isBlank())
          .map(String::trim)
          .ifPresent(val -> urls.put(target, val));
    }
    return new ProxySettings(urls);
  }

  /**
   * Resolves the proxy for a target.
   *
   * @param target traffic class
   * @return proxy URI, or empty when none is configured
   * @throws ConfigurationException if the configured value is not an absolute URL with a host
   */
  public Optional<URI> proxyUri(final Target target) {
    return Optional.ofNullable(urls.get(target)).map(raw -> parse(target, raw));
  }

  private static URI parse(final Target target, final String raw) {
    final URI uri;
    try {
      uri = new URI(raw);
    } catch (final URISyntaxException e) {
      throw new ConfigurationException(
          String.format("invalid proxy URL for %s: %s", target.envVar(), raw), e);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new ConfigurationException(
          String.format("invalid proxy URL for %s: %s", target.envVar(), raw));
    }
    return uri;
  }

  /**
   * Port of a proxy URI, defaulting by scheme.
   *
   * @param uri proxy URI
   * @return explicit port, 443 for https, 80 otherwise
   */
  public static int port(final URI uri) {
    if (uri.getPort() != -1) {
      return uri.getPort();
    }
    return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
  }
}
