package hasync.core.service.realtime;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.config.RealtimeConfig;
import hasync.core.model.auth.Credential;
import hasync.core.model.realtime.InboundMessage;
import hasync.core.model.realtime.OutboundMessage;
import hasync.core.port.in.TokenManagement;
import hasync.core.port.out.RealtimeChannel;

/**
 * Live connections of this instance, indexed by subject and by socket.
 *
 * <p>The per-subject maps are only mutated inside {@link ConcurrentHashMap#compute}, so a
 * registration racing a revocation of the same subject is either seen by the revocation
 * or sees the revoked credential on its own re-check.
 */
@ApplicationScoped
public class ConnectionRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    static final String REVOKED_DURING_HANDSHAKE = "revoked";
    static final String UNSUPPORTED_MESSAGE = "unsupported_message";

    private final Map<String, Map<String, Connection>> bySubject = new ConcurrentHashMap<>();
    private final Map<String, Connection> bySocket = new ConcurrentHashMap<>();

    private final TokenManagement tokens;
    private final RealtimeConfig config;
    private final Clock clock;

    public ConnectionRegistry(TokenManagement tokens, RealtimeConfig config, Clock clock) {
        this.tokens = tokens;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Verify the token presented on upgrade. Failures propagate as {@code TokenException}.
     */
    public Uni<Credential> authenticate(String rawToken) {
        return tokens.verify(rawToken);
    }

    /**
     * Register an upgraded channel and send the {@code connected} frame.
     *
     * <p>If the credential was revoked while the handshake was in flight the connection is
     * closed with the {@code revoked} notice instead.
     */
    public Uni<Connection> register(RealtimeChannel channel, Credential credential) {
        final var connection = new Connection(
                channel,
                credential,
                new OutboundQueue(config.sendQueueCapacity(), config.overflowPolicy()),
                clock.instant());
        channel.drainHandler(connection::drain);

        bySubject.compute(credential.subjectId(), (subject, existing) -> {
            final Map<String, Connection> sockets = existing != null ? existing : new ConcurrentHashMap<>();
            sockets.put(connection.socketId(), connection);
            return sockets;
        });
        bySocket.put(connection.socketId(), connection);

        return tokens.isActive(credential.tokenHash())
                .onFailure()
                .invoke(e -> unregister(connection.socketId()))
                .map(active -> {
                    if (!active) {
                        LOG.infof(
                                "Credential of subject %s revoked during handshake, closing socket %s",
                                connection.subjectId(),
                                connection.socketId());
                        connection.terminate(
                                new OutboundMessage.Revoked(REVOKED_DURING_HANDSHAKE),
                                Connection.CLOSE_REVOKED,
                                REVOKED_DURING_HANDSHAKE);
                        unregister(connection.socketId());
                        return connection;
                    }
                    connection.send(new OutboundMessage.Connected(
                            connection.socketId(),
                            connection.subjectId(),
                            connection.role().value(),
                            connection.authorizedScopes(),
                            clock.instant()));
                    LOG.infof(
                            "Connection registered: socket=%s, subject=%s, role=%s, total=%d",
                            connection.socketId(),
                            connection.subjectId(),
                            connection.role().value(),
                            count());
                    return connection;
                });
    }

    /**
     * Remove a connection. Safe to call more than once.
     *
     * @return true if this call removed it
     */
    public boolean unregister(String socketId) {
        final var removed = bySocket.remove(socketId);
        if (removed == null) {
            return false;
        }
        bySubject.computeIfPresent(removed.subjectId(), (subject, sockets) -> {
            sockets.remove(socketId);
            return sockets.isEmpty() ? null : sockets;
        });
        LOG.debugf("Connection unregistered: socket=%s, subject=%s", socketId, removed.subjectId());
        return true;
    }

    public Optional<Connection> find(String socketId) {
        return Optional.ofNullable(bySocket.get(socketId));
    }

    public List<Connection> findBySubject(String subjectId) {
        final var sockets = bySubject.get(subjectId);
        return sockets == null ? List.of() : List.copyOf(sockets.values());
    }

    public List<Connection> all() {
        return List.copyOf(bySocket.values());
    }

    public int count() {
        return bySocket.size();
    }

    /**
     * Swap the authorized scopes of every connection of a subject.
     *
     * @return the connections that were updated
     */
    public List<Connection> replaceScopes(String subjectId, Set<String> scopes) {
        final List<Connection> updated = new ArrayList<>();
        bySubject.computeIfPresent(subjectId, (subject, sockets) -> {
            sockets.values().forEach(connection -> {
                connection.replaceScopes(scopes);
                updated.add(connection);
            });
            return sockets;
        });
        return updated;
    }

    /**
     * Handle a frame sent by the client on {@code socketId}.
     */
    public void receive(String socketId, InboundMessage message) {
        final var connection = bySocket.get(socketId);
        if (connection == null) {
            LOG.debugf("Frame for unknown socket %s ignored", socketId);
            return;
        }

        if (message instanceof InboundMessage.Subscribe subscribe) {
            final var result = connection.subscribe(subscribe.scopes());
            if (!result.ignored().isEmpty()) {
                LOG.debugf("Socket %s subscription ignored scopes %s", socketId, result.ignored());
            }
            connection.send(result);
        } else if (message instanceof InboundMessage.Ping) {
            connection.send(new OutboundMessage.Pong(clock.instant()));
        } else if (message instanceof InboundMessage.Unsupported unsupported) {
            LOG.debugf("Unsupported frame type '%s' on socket %s", unsupported.type(), socketId);
            connection.send(new OutboundMessage.ErrorNotice(UNSUPPORTED_MESSAGE, "Unsupported message type"));
        }
    }
}
