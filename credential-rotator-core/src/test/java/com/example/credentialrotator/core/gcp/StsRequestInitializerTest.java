package com.example.credentialrotator.core.gcp;

import static org.junit.jupiter.api.Assertions.*;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.testing.http.MockHttpTransport;
import org.junit.jupiter.api.*;

public class StsRequestInitializerTest {

  private final MockHttpTransport transport = new MockHttpTransport();

  @Test
  @DisplayName("Should strip the Authorization header and bound timeouts to one minute")
  void shouldPrepareAnonymousRequest() throws Exception {
    final var request =
        transport
            .createRequestFactory(
                req -> {
                  req.setHeaders(new HttpHeaders().setAuthorization("Bearer leaked"));
                  new StsRequestInitializer().initialize(req);
                })
            .buildGetRequest(new GenericUrl("https://sts.googleapis.com/v1/token"));

    assertNull(request.getHeaders().getAuthorization());
    assertEquals(60_000, request.getConnectTimeout());
    assertEquals(60_000, request.getReadTimeout());
  }
}
