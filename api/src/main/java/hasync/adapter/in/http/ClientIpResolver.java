package hasync.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;

import io.vertx.core.http.HttpServerRequest;

import hasync.core.config.HttpConfig;

/**
 * Determines the client address used as a rate limit key.
 *
 * <p>{@code X-Forwarded-For} is only honoured when configured, since clients can set it freely.
 */
@ApplicationScoped
public class ClientIpResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String UNKNOWN = "unknown";

    private final HttpConfig config;

    public ClientIpResolver(HttpConfig config) {
        this.config = config;
    }

    public String resolve(HttpServerRequest request) {
        final var remote = request.remoteAddress();
        return resolve(request.getHeader(FORWARDED_FOR), remote != null ? remote.hostAddress() : null);
    }

    String resolve(String forwardedFor, String remoteAddress) {
        if (config.trustForwardedFor() && forwardedFor != null && !forwardedFor.isBlank()) {
            // first entry is the original client
            final var first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return remoteAddress != null ? remoteAddress : UNKNOWN;
    }
}
