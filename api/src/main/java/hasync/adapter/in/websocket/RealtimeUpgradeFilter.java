package hasync.adapter.in.websocket;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import hasync.core.config.RealtimeConfig;

/**
 * Vert.x route filter that intercepts WebSocket upgrade requests before JAX-RS.
 *
 * <p>Upgrades on {@code hasync.realtime.path} go to {@link RealtimeGateway}; everything
 * else continues down the normal route chain.
 */
@ApplicationScoped
public class RealtimeUpgradeFilter {

    private static final Logger LOG = Logger.getLogger(RealtimeUpgradeFilter.class);

    private final RealtimeGateway gateway;
    private final RealtimeConfig config;

    public RealtimeUpgradeFilter(RealtimeGateway gateway, RealtimeConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    @RouteFilter(50)
    void interceptWebSocketUpgrade(RoutingContext ctx) {
        if (!isWebSocketUpgrade(ctx.request()) || !config.path().equals(ctx.request().path())) {
            ctx.next();
            return;
        }

        LOG.debugv("Real-time upgrade request on {0}", ctx.request().path());
        gateway.handleUpgrade(ctx);
    }

    static boolean isWebSocketUpgrade(HttpServerRequest request) {
        final var upgrade = request.getHeader("Upgrade");
        final var connection = request.getHeader("Connection");

        return "websocket".equalsIgnoreCase(upgrade)
                && connection != null
                && connection.toLowerCase().contains("upgrade");
    }
}
