package hasync.core.model.auth;

import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;

/**
 * Credential verification or lifecycle failure.
 */
public class TokenException extends ServiceException {

    public TokenException(ErrorCode code, String message) {
        super(code, message);
    }

    public TokenException(ErrorCode code, String message, Throwable cause) {
        super(code, message, null, cause);
    }

    public static TokenException invalid(String message) {
        return new TokenException(ErrorCode.TOKEN_INVALID, message);
    }

    public static TokenException expired() {
        return new TokenException(ErrorCode.TOKEN_EXPIRED, "Token expired");
    }

    public static TokenException revoked() {
        return new TokenException(ErrorCode.TOKEN_REVOKED, "Token revoked");
    }
}
