package hasync.core.port.out;

import hasync.core.model.auth.TokenClaims;
import hasync.core.model.auth.TokenException;

/**
 * Port for producing and checking signed bearer tokens.
 */
public interface TokenSigner {

    /**
     * Sign the claims into a compact token.
     */
    String sign(TokenClaims claims);

    /**
     * Check signature, issuer, audience and expiry and return the claims.
     *
     * @throws TokenException with {@code TOKEN_EXPIRED} or {@code TOKEN_INVALID}
     */
    TokenClaims verify(String token);
}
