package hasync.adapter.in.websocket;

import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

import io.vertx.core.Vertx;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import hasync.adapter.in.auth.BearerTokenAuthenticationMechanism;
import hasync.core.config.RealtimeConfig;
import hasync.core.model.auth.Credential;
import hasync.core.model.auth.TokenException;
import hasync.core.service.realtime.ConnectionRegistry;

/**
 * Authenticates and upgrades real-time WebSocket connections.
 *
 * <p>The credential is verified before the upgrade; an invalid, expired or revoked token
 * gets a plain 401 and the connection is never upgraded. Upgrades beyond
 * {@code hasync.realtime.max-connections} get 503. Registered sockets are pinged, and a
 * socket that misses a pong is closed and unregistered.
 */
@ApplicationScoped
public class RealtimeGateway {

    private static final Logger LOG = Logger.getLogger(RealtimeGateway.class);

    static final String TOKEN_QUERY_PARAM = "token";
    private static final short CLOSE_INTERNAL_ERROR = 1011;
    static final short CLOSE_HEARTBEAT_TIMEOUT = 1002;

    private final ConnectionRegistry registry;
    private final RealtimeMessageCodec codec;
    private final RealtimeConfig config;
    private final Vertx vertx;

    public RealtimeGateway(
            ConnectionRegistry registry, RealtimeMessageCodec codec, RealtimeConfig config, Vertx vertx) {
        this.registry = registry;
        this.codec = codec;
        this.config = config;
        this.vertx = vertx;
    }

    public void handleUpgrade(RoutingContext ctx) {
        if (registry.count() >= config.maxConnections()) {
            LOG.warnv("Real-time connection limit reached ({0})", config.maxConnections());
            ctx.response().setStatusCode(503).end("Service temporarily unavailable: connection limit reached");
            return;
        }

        final var token = extractToken(ctx);
        if (token.isEmpty()) {
            ctx.response().setStatusCode(401).end("Missing credential");
            return;
        }

        registry.authenticate(token.get())
                .subscribe()
                .with(credential -> upgrade(ctx, credential), error -> {
                    if (error instanceof TokenException tokenError) {
                        LOG.debugv("Real-time upgrade rejected: {0}", tokenError.code());
                        ctx.response().setStatusCode(401).end("Invalid credential");
                    } else {
                        LOG.errorv(error, "Real-time authentication failed");
                        ctx.response().setStatusCode(503).end("Service temporarily unavailable");
                    }
                });
    }

    private void upgrade(RoutingContext ctx, Credential credential) {
        ctx.request()
                .toWebSocket()
                .onSuccess(socket -> attach(socket, credential))
                .onFailure(err -> {
                    LOG.warnv(err, "WebSocket upgrade failed for subject {0}", credential.subjectId());
                    if (!ctx.response().ended()) {
                        ctx.response().setStatusCode(500).end("WebSocket upgrade failed");
                    }
                });
    }

    private void attach(ServerWebSocket socket, Credential credential) {
        final var socketId = UUID.randomUUID().toString();
        final var channel = new VertxRealtimeChannel(socketId, socket, codec, vertx, config.closeGrace());
        final var heartbeat = heartbeat(socket, socketId, channel);

        // hold inbound frames until the connection is registered
        socket.pause();
        socket.textMessageHandler(text -> registry.receive(socketId, codec.decode(text)));
        socket.closeHandler(v -> {
            heartbeat.ifPresent(SocketHeartbeat::stop);
            if (registry.unregister(socketId)) {
                LOG.infov("Connection closed: socket={0}, subject={1}", socketId, credential.subjectId());
            }
        });
        socket.exceptionHandler(t -> LOG.debugv("Socket {0} error: {1}", socketId, t.getMessage()));

        registry.register(channel, credential)
                .subscribe()
                .with(
                        connection -> {
                            socket.resume();
                            heartbeat.ifPresent(SocketHeartbeat::start);
                        },
                        error -> {
                            LOG.errorv(error, "Failed to register socket {0}", socketId);
                            registry.unregister(socketId);
                            channel.close(CLOSE_INTERNAL_ERROR, "internal error");
                        });
    }

    private Optional<SocketHeartbeat> heartbeat(ServerWebSocket socket, String socketId, VertxRealtimeChannel channel) {
        final var settings = config.heartbeat();
        if (!settings.enabled()) {
            return Optional.empty();
        }
        return Optional.of(new SocketHeartbeat(vertx, socket, settings.interval(), settings.timeout(), () -> {
            LOG.infov("Socket {0} missed a heartbeat, closing", socketId);
            registry.unregister(socketId);
            channel.close(CLOSE_HEARTBEAT_TIMEOUT, "heartbeat timeout");
        }));
    }

    /**
     * Token from the {@code token} query parameter, or else the bearer header.
     */
    static Optional<String> extractToken(RoutingContext ctx) {
        final var fromQuery = ctx.request().getParam(TOKEN_QUERY_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return Optional.of(fromQuery.trim());
        }
        return BearerTokenAuthenticationMechanism.extractBearerToken(
                ctx.request().getHeader(BearerTokenAuthenticationMechanism.AUTHORIZATION_HEADER));
    }

    public int getActiveConnectionCount() {
        return registry.count();
    }
}
