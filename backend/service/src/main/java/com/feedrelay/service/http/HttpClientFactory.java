package com.feedrelay.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the client shared by the timeline source and the Telegram client.
 * Environment: {@code TRUSTSTORE_PATH}/{@code TRUSTSTORE_PASSWORD} for a custom trust store,
 * {@code RELAY_PROXY} as {@code host:port} for an outbound proxy.
 */
public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        sslContextFromEnvironment(environment).ifPresent(builder::sslContext);
        proxyFromEnvironment(environment).ifPresent(builder::proxy);
        return builder.build();
    }

    static Optional<ProxySelector> proxyFromEnvironment(Map<String, String> environment) {
        String proxy = environment.get("RELAY_PROXY");
        if (proxy == null || proxy.isBlank()) {
            return Optional.empty();
        }
        String[] parts = proxy.trim().split(":", 2);
        if (parts.length != 2 || parts[0].isBlank()) {
            throw new IllegalStateException("RELAY_PROXY must be host:port, got " + proxy);
        }
        try {
            int port = Integer.parseInt(parts[1]);
            return Optional.of(ProxySelector.of(InetSocketAddress.createUnresolved(parts[0], port)));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("RELAY_PROXY must be host:port, got " + proxy, e);
        }
    }

    private static Optional<SSLContext> sslContextFromEnvironment(Map<String, String> environment) {
        String truststorePath = environment.get("TRUSTSTORE_PATH");
        if (truststorePath == null || truststorePath.isBlank()) {
            return Optional.empty();
        }

        String truststorePassword = environment.get("TRUSTSTORE_PASSWORD");
        if (truststorePassword == null) {
            throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
        }

        Path path = Path.of(truststorePath);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(truststoreType(path));
            trustStore.load(in, truststorePassword.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return Optional.of(sslContext);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
