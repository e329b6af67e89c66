package org.catalogregistry.registry.common.http;

import java.time.Duration;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * REST client on reactor-netty. Plain HTTP services are reached without TLS; HTTPS services
 * use the JDK trust store unless the connection is marked insecure.
 */
public class ReactorNettyRestClient extends AbstractRestClient {
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(60);

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0, DEFAULT_RESPONSE_TIMEOUT);
    }

    /**
     * @param maxConnections size of the connection pool, or 0 for reactor-netty's shared pool
     * @param responseTimeout how long to wait for a response once a request is written
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections, Duration responseTimeout) {
        super(connectionContext, new ReactorNettyAdapter(httpClient(connectionContext, maxConnections,
            responseTimeout)));
    }

    private static HttpClient httpClient(ConnectionContext connectionContext, int maxConnections,
                                         Duration responseTimeout) {
        var client = maxConnections <= 0
            ? HttpClient.create()
            : HttpClient.create(ConnectionProvider.create("registry-" + connectionContext.getUri().getHost(),
                maxConnections));
        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            client = client.secure(connectionContext.isInsecure()
                ? trustAllProvider()
                : SslProvider.defaultClientProvider());
        }
        return client
            .baseUrl(connectionContext.origin())
            .responseTimeout(responseTimeout)
            .disableRetry(false) // one immediate retry on connection reset
            .keepAlive(true);
    }

    /** Accepts any certificate and skips host name verification. */
    private static SslProvider trustAllProvider() {
        try {
            var sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(handler -> {
                    var engine = handler.engine();
                    SSLParameters parameters = engine.getSSLParameters();
                    parameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(parameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot build an insecure TLS context", e);
        }
    }
}
