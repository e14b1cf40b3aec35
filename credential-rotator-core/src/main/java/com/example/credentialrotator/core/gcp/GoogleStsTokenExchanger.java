package com.example.credentialrotator.core.gcp;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.credentialrotator.core.TokenExchangeException;
import com.example.credentialrotator.core.policy.GcpCredentials.WorkloadIdentityFederationConfig;
import com.example.credentialrotator.core.token.TokenExpiry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.UrlEncodedContent;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * {@link StsTokenExchanger} calling the Google Security Token Service with an RFC 8693 token
 * exchange. The request is sent without an Authorization header; the subject token travels in the
 * body.
 */
public class GoogleStsTokenExchanger implements StsTokenExchanger {

  private static final System.Logger logger =
      System.getLogger(GoogleStsTokenExchanger.class.getName());

  public static final String DEFAULT_ENDPOINT = "https://sts.googleapis.com/v1/token";

  static final String GRANT_TYPE_TOKEN_EXCHANGE = "urn:ietf:params:oauth:grant-type:token-exchange";
  static final String IAM_SCOPE = "https://www.googleapis.com/auth/iam";
  static final String TOKEN_TYPE_ACCESS_TOKEN = "urn:ietf:params:oauth:token-type:access_token";
  static final String TOKEN_TYPE_JWT = "urn:ietf:params:oauth:token-type:jwt";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final GcpHttpTransportFactory transportFactory;
  private final String endpoint;
  private final Clock clock;

  public GoogleStsTokenExchanger(final GcpHttpTransportFactory transportFactory) {
    this(transportFactory, DEFAULT_ENDPOINT, Clock.systemUTC());
  }

  GoogleStsTokenExchanger(
      final GcpHttpTransportFactory transportFactory, final String endpoint, final Clock clock) {
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public TokenExpiry exchange(
      final String subjectToken, final WorkloadIdentityFederationConfig federation) {
    final var audience = federation.audience();
    final var form = new LinkedHashMap<String, String>();
    form.put("grant_type", GRANT_TYPE_TOKEN_EXCHANGE);
    form.put("audience", audience);
    form.put("scope", IAM_SCOPE);
    form.put("requested_token_type", TOKEN_TYPE_ACCESS_TOKEN);
    form.put("subject_token", subjectToken);
    form.put("subject_token_type", TOKEN_TYPE_JWT);

    try {
      final var request =
          transportFactory
              .create()
              .createRequestFactory(new StsRequestInitializer())
              .buildPostRequest(new GenericUrl(endpoint), new UrlEncodedContent(form));
      final var response = request.execute();
      try {
        final var body = MAPPER.readTree(response.getContent());
        final var accessToken = body.path("access_token").asText("");
        final var expiresIn = body.path("expires_in").asLong(0);
        if (accessToken.isEmpty() || expiresIn <= 0) {
          throw new TokenExchangeException(
              "GCP STS response lacks access_token or expires_in for audience " + audience);
        }
        logger.log(DEBUG, "Exchanged token at GCP STS for audience {0}", audience);
        return new TokenExpiry(accessToken, clock.instant().plusSeconds(expiresIn));
      } finally {
        response.disconnect();
      }
    } catch (final HttpResponseException e) {
      throw new TokenExchangeException(
          String.format(
              "GCP STS token exchange failed with HTTP %d for audience %s",
              e.getStatusCode(), audience),
          e);
    } catch (final IOException e) {
      throw new TokenExchangeException(
          "Failed to call GCP STS token API with audience " + audience, e);
    }
  }
}
