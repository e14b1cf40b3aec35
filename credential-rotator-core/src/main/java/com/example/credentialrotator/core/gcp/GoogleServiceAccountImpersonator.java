package com.example.credentialrotator.core.gcp;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialrotator.core.TokenExchangeException;
import com.example.credentialrotator.core.token.TokenExpiry;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ImpersonatedCredentials;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * {@link ServiceAccountImpersonator} backed by google-auth-library {@link ImpersonatedCredentials}.
 * The caller token is installed as the source credential, so it is sent as {@code Authorization:
 * Bearer} to the IAM credentials API.
 */
public class GoogleServiceAccountImpersonator implements ServiceAccountImpersonator {

  private static final System.Logger logger =
      System.getLogger(GoogleServiceAccountImpersonator.class.getName());

  static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";
  static final int LIFETIME_SECONDS = 3600;

  private final GcpHttpTransportFactory transportFactory;

  public GoogleServiceAccountImpersonator(final GcpHttpTransportFactory transportFactory) {
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
  }

  @Override
  public TokenExpiry impersonate(final String bearerToken, final String serviceAccountEmail) {
    final var source = GoogleCredentials.create(new AccessToken(bearerToken, null));
    final var impersonated =
        ImpersonatedCredentials.create(
            source,
            serviceAccountEmail,
            null,
            List.of(CLOUD_PLATFORM_SCOPE),
            LIFETIME_SECONDS,
            transportFactory);
    final AccessToken token;
    try {
      token = impersonated.refreshAccessToken();
    } catch (final IOException e) {
      throw new TokenExchangeException(
          "Failed to impersonate service account " + serviceAccountEmail, e);
    }
    if (token == null || token.getExpirationTime() == null) {
      throw new TokenExchangeException(
          "Impersonation of " + serviceAccountEmail + " returned no token expiry");
    }
    logger.log(DEBUG, "Impersonated service account {0}", serviceAccountEmail);
    return new TokenExpiry(token.getTokenValue(), token.getExpirationTime().toInstant());
  }
}
