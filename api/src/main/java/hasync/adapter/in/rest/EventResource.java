package hasync.adapter.in.rest;

import java.time.Clock;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import hasync.adapter.in.auth.Roles;
import hasync.adapter.in.dto.PublishEventRequest;
import hasync.adapter.in.dto.PublishEventResponse;
import hasync.adapter.in.problem.ApiProblem;
import hasync.core.model.realtime.EventTarget;
import hasync.core.model.realtime.RealtimeEvent;
import hasync.core.service.realtime.EventBroadcaster;

/**
 * REST resource for publishing events to connected clients.
 */
@Path("/api/events")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EventResource {

    private final EventBroadcaster broadcaster;
    private final Clock clock;

    public EventResource(EventBroadcaster broadcaster, Clock clock) {
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @POST
    @RolesAllowed(Roles.ADMIN)
    public Uni<PublishEventResponse> publish(@Valid @NotNull PublishEventRequest request) {
        final var hasScope = request.scope() != null && !request.scope().isBlank();
        final var hasSubject = request.subjectId() != null && !request.subjectId().isBlank();
        if (hasScope == hasSubject) {
            throw ApiProblem.validationError("exactly one of scope and subjectId is required");
        }

        final var target = hasScope ? EventTarget.scope(request.scope()) : EventTarget.subject(request.subjectId());
        return broadcaster
                .publish(new RealtimeEvent(request.type(), target, request.payload(), clock.instant()))
                .map(PublishEventResponse::new);
    }
}
