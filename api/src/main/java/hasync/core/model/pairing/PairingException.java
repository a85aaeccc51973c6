package hasync.core.model.pairing;

import java.util.OptionalInt;

import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;

/**
 * Pairing state machine violation.
 *
 * <p>Carries the number of attempts left when a wrong PIN was charged to a session.
 */
public class PairingException extends ServiceException {

    private final Integer attemptsRemaining;

    public PairingException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public PairingException(ErrorCode code, String message, Integer attemptsRemaining) {
        super(code, message);
        this.attemptsRemaining = attemptsRemaining;
    }

    public OptionalInt attemptsRemaining() {
        return attemptsRemaining == null ? OptionalInt.empty() : OptionalInt.of(attemptsRemaining);
    }

    public static PairingException notFound(String sessionId) {
        return new PairingException(ErrorCode.SESSION_NOT_FOUND, "Pairing session not found: " + sessionId);
    }

    public static PairingException expired(String sessionId) {
        return new PairingException(ErrorCode.SESSION_EXPIRED, "Pairing session expired: " + sessionId);
    }

    public static PairingException alreadyUsed(String sessionId) {
        return new PairingException(ErrorCode.SESSION_ALREADY_USED, "Pairing session already used: " + sessionId);
    }

    public static PairingException notVerified(String sessionId) {
        return new PairingException(ErrorCode.SESSION_NOT_VERIFIED, "Pairing session not verified: " + sessionId);
    }

    public static PairingException locked(String sessionId) {
        return new PairingException(
                ErrorCode.MAX_ATTEMPTS_EXCEEDED, "Maximum attempts exceeded for session: " + sessionId, 0);
    }
}
