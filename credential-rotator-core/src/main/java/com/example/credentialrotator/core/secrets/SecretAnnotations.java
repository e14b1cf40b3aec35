package com.example.credentialrotator.core.secrets;

import com.example.credentialrotator.core.InconsistentSecretException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Reads and writes the expiration annotation of credential secrets. */
public final class SecretAnnotations {

  /** Annotation key holding the RFC 3339 expiration time of the stored credential. */
  public static final String EXPIRATION_TIME_KEY = "rotators/expiration-time";

  private SecretAnnotations() {}

  /**
   * Formats an instant the way it is stored: RFC 3339 in UTC with second precision.
   *
   * @param expiresAt expiration time
   * @return formatted timestamp
   */
  public static String format(final Instant expiresAt) {
    return expiresAt.truncatedTo(ChronoUnit.SECONDS).toString();
  }

  /**
   * Returns a copy of {@code annotations} with the expiration annotation set.
   *
   * @param annotations existing annotations, may be {@code null}
   * @param expiresAt expiration time
   * @return new annotation map
   */
  public static Map<String, String> withExpiration(
      final Map<String, String> annotations, final Instant expiresAt) {
    final var updated = new HashMap<String, String>();
    Optional.ofNullable(annotations).ifPresent(updated::putAll);
    updated.put(EXPIRATION_TIME_KEY, format(expiresAt));
    return updated;
  }

  /**
   * Reads the expiration annotation of a secret.
   *
   * @param secret credential secret
   * @return the stored expiration time
   * @throws InconsistentSecretException if the annotation is missing or cannot be parsed
   */
  public static Instant expiration(final CredentialSecret secret) {
    final var raw = secret.annotations().get(EXPIRATION_TIME_KEY);
    if (raw == null || raw.isBlank()) {
      throw new InconsistentSecretException(
          String.format(
              "secret %s/%s has no %s annotation",
              secret.namespace(), secret.name(), EXPIRATION_TIME_KEY));
    }
    try {
      return OffsetDateTime.parse(raw.trim()).toInstant();
    } catch (final DateTimeParseException e) {
      throw new InconsistentSecretException(
          String.format(
              "secret %s/%s has an unparsable %s annotation: %s",
              secret.namespace(), secret.name(), EXPIRATION_TIME_KEY, raw),
          e);
    }
  }
}
