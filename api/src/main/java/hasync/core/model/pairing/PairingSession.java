package hasync.core.model.pairing;

import java.time.Instant;

/**
 * A short-lived PIN pairing session.
 *
 * <p>Only the keyed hash of the PIN is held. Every transition returns a copy with
 * {@code version} incremented, so stores can apply it as a compare-and-set against
 * the version that was read.
 *
 * @param id          opaque session id ({@code pair_...})
 * @param pinHash     HMAC-SHA256 of the PIN, hex encoded
 * @param status      current lifecycle state
 * @param deviceName  name reported by the device, set on verification
 * @param deviceType  device kind, set on verification
 * @param createdBy   administrator who created the session
 * @param createdAt   creation time
 * @param expiresAt   time after which the PIN is rejected
 * @param verifiedAt  verification time, present iff VERIFIED or COMPLETED
 * @param completedAt completion time, present iff COMPLETED
 * @param attempts    wrong PIN attempts charged to this session
 * @param maxAttempts attempts allowed before the session locks
 * @param version     optimistic concurrency counter
 * @param cancelled   true when EXPIRED by an administrator rather than by timeout
 */
public record PairingSession(
        String id,
        String pinHash,
        PairingStatus status,
        String deviceName,
        DeviceType deviceType,
        String createdBy,
        Instant createdAt,
        Instant expiresAt,
        Instant verifiedAt,
        Instant completedAt,
        int attempts,
        int maxAttempts,
        long version,
        boolean cancelled) {

    public PairingSession {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (pinHash == null || pinHash.isBlank()) {
            throw new IllegalArgumentException("PIN hash cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Creation and expiry times are required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (attempts < 0 || attempts > maxAttempts) {
            throw new IllegalArgumentException("attempts must be between 0 and " + maxAttempts + ", got " + attempts);
        }
        final var verifiedState = status == PairingStatus.VERIFIED || status == PairingStatus.COMPLETED;
        if (verifiedState != (verifiedAt != null)) {
            throw new IllegalArgumentException("verifiedAt must be set iff status is VERIFIED or COMPLETED");
        }
        if ((status == PairingStatus.COMPLETED) != (completedAt != null)) {
            throw new IllegalArgumentException("completedAt must be set iff status is COMPLETED");
        }
    }

    /**
     * Create a new PENDING session.
     */
    public static PairingSession pending(
            String id, String pinHash, String createdBy, Instant createdAt, Instant expiresAt, int maxAttempts) {
        return new PairingSession(
                id,
                pinHash,
                PairingStatus.PENDING,
                null,
                null,
                createdBy,
                createdAt,
                expiresAt,
                null,
                null,
                0,
                maxAttempts,
                0L,
                false);
    }

    /** Whether the PIN has timed out at {@code now}. */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    /** Whether the wrong-PIN allowance is spent. */
    public boolean isLocked() {
        return attempts >= maxAttempts;
    }

    public int attemptsRemaining() {
        return Math.max(0, maxAttempts - attempts);
    }

    /**
     * Whether a wrong PIN attempt can still be charged to this session.
     */
    public boolean acceptsAttempts(Instant now) {
        return status == PairingStatus.PENDING && !isExpiredAt(now) && !isLocked();
    }

    public PairingSession withAttemptCharged() {
        return new PairingSession(
                id,
                pinHash,
                status,
                deviceName,
                deviceType,
                createdBy,
                createdAt,
                expiresAt,
                verifiedAt,
                completedAt,
                attempts + 1,
                maxAttempts,
                version + 1,
                cancelled);
    }

    public PairingSession verified(String newDeviceName, DeviceType newDeviceType, Instant now) {
        return new PairingSession(
                id,
                pinHash,
                PairingStatus.VERIFIED,
                newDeviceName,
                newDeviceType,
                createdBy,
                createdAt,
                expiresAt,
                now,
                null,
                attempts,
                maxAttempts,
                version + 1,
                false);
    }

    public PairingSession completed(Instant now) {
        return new PairingSession(
                id,
                pinHash,
                PairingStatus.COMPLETED,
                deviceName,
                deviceType,
                createdBy,
                createdAt,
                expiresAt,
                verifiedAt,
                now,
                attempts,
                maxAttempts,
                version + 1,
                false);
    }

    /**
     * Move to EXPIRED. {@code verifiedAt} is cleared since the session never completed.
     *
     * @param byCancellation true when an administrator cancelled the session
     */
    public PairingSession expired(boolean byCancellation) {
        return new PairingSession(
                id,
                pinHash,
                PairingStatus.EXPIRED,
                deviceName,
                deviceType,
                createdBy,
                createdAt,
                expiresAt,
                null,
                null,
                attempts,
                maxAttempts,
                version + 1,
                byCancellation);
    }

    /**
     * Time from which the session counts toward retention: completion for completed
     * sessions, PIN expiry otherwise.
     */
    public Instant retentionAnchor() {
        return completedAt != null ? completedAt : expiresAt;
    }

    @Override
    public String toString() {
        return "PairingSession[id=" + id + ", status=" + status + ", attempts=" + attempts + "/" + maxAttempts
                + ", version=" + version + ", expiresAt=" + expiresAt + "]";
    }
}
