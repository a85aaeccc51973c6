package hasync.core.model.pairing;

import java.time.Instant;

/**
 * Result of creating a pairing session. The raw PIN is only available here.
 *
 * @param id        the session id
 * @param pin       the six digit PIN to display to the administrator
 * @param expiresAt when the PIN stops being accepted
 */
public record PairingSessionCreated(String id, String pin, Instant expiresAt) {

    @Override
    public String toString() {
        return "PairingSessionCreated[id=" + id + ", pin=******, expiresAt=" + expiresAt + "]";
    }
}
