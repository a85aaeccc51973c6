package hasync.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import hasync.core.config.RealtimeConfig;
import hasync.core.service.realtime.ConnectionRegistry;

/**
 * Readiness of the real-time gateway.
 *
 * <p>Reports open connections against {@code hasync.realtime.max-connections}. At the
 * limit every new upgrade is refused with 503, so the check reports DOWN until a slot
 * frees up.
 */
@Readiness
@ApplicationScoped
public class RealtimeConnectionsHealthCheck implements HealthCheck {

    static final String NAME = "realtime-connections";

    private final ConnectionRegistry registry;
    private final RealtimeConfig config;

    @Inject
    public RealtimeConnectionsHealthCheck(ConnectionRegistry registry, RealtimeConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        final int open = registry.count();
        final int max = config.maxConnections();
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);
        builder.withData("hasync.realtime.connections.open", open);
        builder.withData("hasync.realtime.connections.max", max);
        return builder.status(open < max).build();
    }
}
