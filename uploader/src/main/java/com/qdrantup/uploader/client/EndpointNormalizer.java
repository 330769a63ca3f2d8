package com.qdrantup.uploader.client;

import com.qdrantup.uploader.exception.InvalidEndpointException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes the configured endpoint so it targets Qdrant's gRPC port.
 *
 * <p>Operators usually copy the REST/dashboard URL of a cluster, which has no port
 * (or 6333). Qdrant Cloud serves gRPC on 6334 of the same host, so a URL without a port
 * gets 6334. A port equal to the scheme default (80 for http, 443 for https) counts as no
 * port. Any other explicit port is left alone.
 *
 * <p>Host names must be valid server names: names containing {@code _} (common for
 * docker-compose services) are rejected, since neither {@link URI} nor gRPC's DNS resolver
 * accept them. Use the service's IP address or an alias without underscores instead.
 */
public final class EndpointNormalizer {

    public static final int GRPC_PORT = 6334;

    private static final Map<String, Integer> DEFAULT_PORTS = Map.of("http", 80, "https", 443);

    private EndpointNormalizer() {}

    /**
     * @param endpoint absolute URL such as {@code https://xyz.cloud.qdrant.io}
     * @return the canonical endpoint, with an explicit port and a non-empty path
     * @throws InvalidEndpointException if the string is not an absolute, host-based URL
     */
    public static URI normalize(String endpoint) throws InvalidEndpointException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidEndpointException("Invalid URL: endpoint is empty");
        }

        URI parsed;
        try {
            parsed = new URI(endpoint.trim());
        } catch (URISyntaxException e) {
            throw new InvalidEndpointException("Invalid URL: " + endpoint, e);
        }

        if (!parsed.isAbsolute()) {
            throw new InvalidEndpointException("Invalid URL: " + endpoint + " (missing scheme)");
        }
        if (!parsed.isOpaque() && parsed.getHost() == null
                && parsed.getRawAuthority() != null && parsed.getRawAuthority().contains("_")) {
            throw new InvalidEndpointException("Invalid URL: " + endpoint
                    + " (host names containing '_' are not supported, use an IP address or another alias)");
        }
        if (parsed.isOpaque() || parsed.getHost() == null) {
            throw new InvalidEndpointException("Failed to set port on " + endpoint + " (no host)");
        }

        String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
        int port = hasExplicitPort(scheme, parsed.getPort()) ? parsed.getPort() : GRPC_PORT;
        String path = parsed.getRawPath() == null || parsed.getRawPath().isEmpty() ? "/" : parsed.getRawPath();

        StringBuilder canonical = new StringBuilder()
                .append(scheme)
                .append("://");
        if (parsed.getRawUserInfo() != null) {
            canonical.append(parsed.getRawUserInfo()).append('@');
        }
        canonical.append(parsed.getHost().toLowerCase(Locale.ROOT))
                .append(':').append(port)
                .append(path)
                .append(suffix(parsed));

        try {
            return new URI(canonical.toString());
        } catch (URISyntaxException e) {
            throw new InvalidEndpointException("Failed to set port on " + endpoint, e);
        }
    }

    private static boolean hasExplicitPort(String scheme, int port) {
        if (port == -1) {
            return false;
        }
        Integer schemeDefault = DEFAULT_PORTS.get(scheme);
        return schemeDefault == null || schemeDefault != port;
    }

    private static String suffix(URI uri) {
        StringBuilder sb = new StringBuilder();
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return sb.toString();
    }
}
