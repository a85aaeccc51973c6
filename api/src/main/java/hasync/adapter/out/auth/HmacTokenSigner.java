package hasync.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import hasync.core.config.TokenConfig;
import hasync.core.model.auth.Role;
import hasync.core.model.auth.TokenClaims;
import hasync.core.model.auth.TokenException;
import hasync.core.model.common.ErrorCode;
import hasync.core.port.out.TokenSigner;

/**
 * HS256 (HMAC with SHA-256) token signer.
 *
 * <p>Signs and verifies compact JWS tokens with the configured signing secret.
 * Issuer and audience are taken from the same configuration on both sides, and
 * expiry is evaluated against the injected {@link Clock}.
 */
@ApplicationScoped
public class HmacTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(HmacTokenSigner.class);

    static final String ROLE_CLAIM = "role";
    static final String SCOPES_CLAIM = "scopes";
    static final String NONCE_CLAIM = "nonce";

    private final TokenConfig config;
    private final Clock clock;

    public HmacTokenSigner(TokenConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String sign(TokenClaims tokenClaims) {
        final var claims = new JwtClaims();
        claims.setIssuer(config.issuer());
        claims.setAudience(config.audience());
        claims.setSubject(tokenClaims.subjectId());
        claims.setJwtId(tokenClaims.tokenId());
        claims.setIssuedAt(NumericDate.fromSeconds(tokenClaims.issuedAt().getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(tokenClaims.expiresAt().getEpochSecond()));
        claims.setClaim(ROLE_CLAIM, tokenClaims.role().value());
        claims.setStringListClaim(SCOPES_CLAIM, new ArrayList<>(tokenClaims.scopes()));
        claims.setClaim(NONCE_CLAIM, tokenClaims.nonce());

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new TokenSigningException("Failed to sign token", e);
        }
    }

    @Override
    public TokenClaims verify(String token) {
        final var consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setRequireSubject()
                .setRequireJwtId()
                .setAllowedClockSkewInSeconds(0)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setExpectedIssuer(config.issuer())
                .setExpectedAudience(config.audience())
                .setVerificationKey(key())
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .build();

        try {
            final var claims = consumer.processToClaims(token);
            return toTokenClaims(claims);
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                throw TokenException.expired();
            }
            LOG.debugf("Token rejected: %s", e.getMessage());
            throw new TokenException(ErrorCode.TOKEN_INVALID, "Invalid token", e);
        } catch (MalformedClaimException | IllegalArgumentException e) {
            LOG.debugf("Token has malformed claims: %s", e.getMessage());
            throw new TokenException(ErrorCode.TOKEN_INVALID, "Malformed claims", e);
        }
    }

    private TokenClaims toTokenClaims(JwtClaims claims) throws MalformedClaimException {
        final Set<String> scopes = claims.hasClaim(SCOPES_CLAIM)
                ? new HashSet<>(claims.getStringListClaimValue(SCOPES_CLAIM))
                : Set.of();
        return new TokenClaims(
                claims.getSubject(),
                claims.getJwtId(),
                Role.fromValue(claims.getStringClaimValue(ROLE_CLAIM)),
                scopes,
                Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                Instant.ofEpochSecond(claims.getExpirationTime().getValue()),
                claims.getStringClaimValue(NONCE_CLAIM));
    }

    private HmacKey key() {
        final var secret = config.signingSecret()
                .filter(s -> s.length() >= TokenConfig.MIN_SECRET_LENGTH)
                .orElseThrow(() -> new IllegalStateException("hasync.auth.token.signing-secret is not configured"));
        return new HmacKey(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Exception thrown when a token cannot be signed.
     */
    public static class TokenSigningException extends RuntimeException {
        public TokenSigningException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
