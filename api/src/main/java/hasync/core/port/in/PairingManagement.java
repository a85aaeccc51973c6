package hasync.core.port.in;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import hasync.core.model.pairing.CleanupResult;
import hasync.core.model.pairing.DeviceType;
import hasync.core.model.pairing.PairingCompletion;
import hasync.core.model.pairing.PairingException;
import hasync.core.model.pairing.PairingSession;
import hasync.core.model.pairing.PairingSessionCreated;

/**
 * Port for the PIN pairing state machine.
 *
 * <p>State violations fail the returned {@link Uni} with a {@link PairingException}.
 */
public interface PairingManagement {

    /**
     * Create a PENDING session with a fresh six digit PIN.
     *
     * @param createdBy the administrator creating the session
     * @return the session id, the raw PIN (returned only here) and its expiry
     */
    Uni<PairingSessionCreated> createSession(String createdBy);

    /**
     * Verify a PIN entered on a device and move the matching session to VERIFIED.
     *
     * <p>A wrong PIN is charged as an attempt to the hinted session, or to every open
     * session when no hint is given.
     *
     * @param pin           the PIN as entered
     * @param deviceName    name reported by the device
     * @param deviceType    device kind
     * @param sessionIdHint optional session the device expects to pair with
     * @return the verified session id
     */
    Uni<String> verifySession(String pin, String deviceName, DeviceType deviceType, Optional<String> sessionIdHint);

    /**
     * Complete a VERIFIED session: mint the client credential and record the client.
     *
     * @param sessionId      the session to complete
     * @param clientName     display name for the client, defaults to the device name
     * @param assignedScopes scopes granted to the client (may be empty)
     * @param completedBy    the administrator completing the session
     */
    Uni<PairingCompletion> completeSession(
            String sessionId, String clientName, Set<String> assignedScopes, String completedBy);

    /**
     * Cancel an open session. Cancelling an already expired session is a no-op.
     */
    Uni<Void> cancelSession(String sessionId, String cancelledBy);

    Uni<PairingSession> getSession(String sessionId);

    /**
     * Expire open sessions past their PIN lifetime and delete terminal sessions past retention.
     */
    Uni<CleanupResult> cleanupExpired(Instant now);
}
