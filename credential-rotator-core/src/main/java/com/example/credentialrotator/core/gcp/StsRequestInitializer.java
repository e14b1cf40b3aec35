package com.example.credentialrotator.core.gcp;

import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestInitializer;
import java.time.Duration;

/**
 * Prepares GCP STS requests built from the shared transport: no {@code Authorization} header, since
 * the subject token travels in the body, and connect and read timeouts bounded by {@link
 * #TIMEOUT}.
 */
public class StsRequestInitializer implements HttpRequestInitializer {

  static final Duration TIMEOUT = Duration.ofMinutes(1);

  @Override
  public void initialize(final HttpRequest request) {
    request.setConnectTimeout((int) TIMEOUT.toMillis());
    request.setReadTimeout((int) TIMEOUT.toMillis());
    request.getHeaders().setAuthorization((String) null);
  }
}
