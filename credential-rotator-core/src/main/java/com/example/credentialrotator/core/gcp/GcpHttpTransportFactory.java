package com.example.credentialrotator.core.gcp;

import com.example.credentialrotator.core.http.ProxySettings;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.auth.http.HttpTransportFactory;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.Objects;

/**
 * Supplies the single HTTP transport shared by all GCP auth calls, routed through the GCP auth
 * proxy when one is configured. The transport is built once and reused.
 */
public class GcpHttpTransportFactory implements HttpTransportFactory {

  private final HttpTransport transport;

  public GcpHttpTransportFactory(final HttpTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
  }

  /**
   * Builds a {@link NetHttpTransport} honouring the {@link ProxySettings.Target#GCP_AUTH} proxy.
   *
   * @param proxies proxy configuration
   * @return factory wrapping the new transport
   */
  public static GcpHttpTransportFactory create(final ProxySettings proxies) {
    final var builder = new NetHttpTransport.Builder();
    proxies
        .proxyUri(ProxySettings.Target.GCP_AUTH)
        .ifPresent(
            uri ->
                builder.setProxy(
                    new Proxy(
                        Proxy.Type.HTTP,
                        new InetSocketAddress(uri.getHost(), ProxySettings.port(uri)))));
    return new GcpHttpTransportFactory(builder.build());
  }

  @Override
  public HttpTransport create() {
    return transport;
  }
}
