package hasync.core.model.pairing;

import java.time.Instant;

/**
 * A device that completed pairing and owns a client credential.
 *
 * @param subjectId        the credential subject ({@code client_...})
 * @param clientName       display name chosen by the administrator
 * @param deviceName       name reported by the device during verification
 * @param deviceType       kind of device
 * @param pairingSessionId the session the device paired through
 * @param pairedBy         the administrator who completed pairing
 * @param pairedAt         completion time
 */
public record PairedClient(
        String subjectId,
        String clientName,
        String deviceName,
        DeviceType deviceType,
        String pairingSessionId,
        String pairedBy,
        Instant pairedAt) {

    public PairedClient {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject ID cannot be null or blank");
        }
        if (pairedAt == null) {
            throw new IllegalArgumentException("Paired time cannot be null");
        }
        if (deviceType == null) {
            deviceType = DeviceType.OTHER;
        }
    }
}
