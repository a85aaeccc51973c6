package hasync.core.model.pairing;

import java.time.Instant;
import java.util.Set;

/**
 * A paired client joined with the state of its newest credential.
 *
 * @param client         the paired client record
 * @param assignedScopes scopes of the active credential, empty if none is active
 * @param active         whether the client holds an active credential
 * @param lastSeenAt     last successful token verification, if any
 */
public record ClientView(PairedClient client, Set<String> assignedScopes, boolean active, Instant lastSeenAt) {}
