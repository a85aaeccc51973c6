package hasync.core.service.realtime;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.model.auth.CredentialRevokedEvent;
import hasync.core.model.auth.ScopesChangedEvent;
import hasync.core.model.realtime.EventTarget;
import hasync.core.model.realtime.OutboundMessage;
import hasync.core.model.realtime.RealtimeEvent;

/**
 * Fans events out to live connections and applies credential changes to them.
 *
 * <p>Revocation and scope changes are observed synchronously, so the affected sockets
 * are closed or re-scoped before the request that caused the change returns.
 */
@ApplicationScoped
public class EventBroadcaster {

    private static final Logger LOG = Logger.getLogger(EventBroadcaster.class);

    private final ConnectionRegistry registry;

    public EventBroadcaster(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Deliver an event to every connection allowed to see it.
     *
     * @return number of connections the event was queued on
     */
    public Uni<Integer> publish(RealtimeEvent event) {
        return Uni.createFrom().item(() -> {
            final int delivered;
            if (event.target() instanceof EventTarget.Scope scope) {
                final var frame = new OutboundMessage.EventMessage(
                        event.eventType(), scope.scopeId(), event.payload(), event.timestamp());
                delivered = (int) registry.all().stream()
                        .filter(connection -> connection.canReceive(scope.scopeId()))
                        .filter(connection -> connection.send(frame))
                        .count();
            } else if (event.target() instanceof EventTarget.Subject subject) {
                final var frame =
                        new OutboundMessage.EventMessage(event.eventType(), null, event.payload(), event.timestamp());
                delivered = (int) registry.findBySubject(subject.subjectId()).stream()
                        .filter(connection -> connection.send(frame))
                        .count();
            } else {
                throw new IllegalArgumentException("Unsupported event target " + event.target());
            }
            LOG.debugf("Event %s to %s delivered to %d connection(s)", event.eventType(), event.target(), delivered);
            return delivered;
        });
    }

    /**
     * Close the subject's connections with a {@code revoked} notice. A token-scoped
     * revocation only closes connections opened with that token.
     */
    public void onRevocation(@Observes CredentialRevokedEvent event) {
        var closed = 0;
        for (Connection connection : registry.findBySubject(event.subjectId())) {
            if (event.tokenHash().isPresent() && !event.tokenHash().get().equals(connection.tokenHash())) {
                continue;
            }
            connection.terminate(
                    new OutboundMessage.Revoked(event.reason()), Connection.CLOSE_REVOKED, event.reason());
            registry.unregister(connection.socketId());
            closed++;
        }
        if (closed > 0) {
            LOG.infof(
                    "Closed %d connection(s) of subject %s after revocation (%s)",
                    closed,
                    event.subjectId(),
                    event.reason());
        }
    }

    /**
     * Re-scope the subject's connections and tell each client what changed.
     */
    public void onScopeChange(@Observes ScopesChangedEvent event) {
        final var frame = new OutboundMessage.ScopeChanged(event.newScopes(), event.added(), event.removed());
        final var updated = registry.replaceScopes(event.subjectId(), event.newScopes());
        updated.forEach(connection -> connection.send(frame));
        if (!updated.isEmpty()) {
            LOG.infof("Updated scopes on %d connection(s) of subject %s", updated.size(), event.subjectId());
        }
    }
}
