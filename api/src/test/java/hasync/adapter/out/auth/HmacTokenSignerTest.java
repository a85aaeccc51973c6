package hasync.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import hasync.core.model.auth.Role;
import hasync.core.model.auth.TokenClaims;
import hasync.core.model.auth.TokenException;
import hasync.core.model.common.ErrorCode;
import hasync.support.MutableClock;
import hasync.support.TestConfigs.TestTokenConfig;

@DisplayName("HmacTokenSigner")
class HmacTokenSignerTest {

    private MutableClock clock;
    private HmacTokenSigner signer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-15T10:00:00Z");
        signer = new HmacTokenSigner(new TestTokenConfig(), clock);
    }

    private TokenClaims claims(Duration ttl) {
        var now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return new TokenClaims(
                "client_abc", "jti-1", Role.CLIENT, Set.of("kitchen", "garage"), now, now.plus(ttl), "nonce-1");
    }

    @Test
    @DisplayName("should round trip every claim")
    void shouldRoundTripClaims() {
        var claims = claims(Duration.ofHours(1));

        var verified = signer.verify(signer.sign(claims));

        assertEquals(claims, verified);
    }

    @Test
    @DisplayName("should reject a token signed with another secret")
    void shouldRejectForeignSignature() {
        var other = new HmacTokenSigner(
                new TestTokenConfig().withSigningSecret("another-secret-that-is-long-enough-0123"), clock);
        var token = other.sign(claims(Duration.ofHours(1)));

        var ex = assertThrows(TokenException.class, () -> signer.verify(token));

        assertEquals(ErrorCode.TOKEN_INVALID, ex.code());
    }

    @Test
    @DisplayName("should reject a token from another issuer")
    void shouldRejectForeignIssuer() {
        var other = new HmacTokenSigner(new TestTokenConfig().withIssuer("someone-else"), clock);
        var token = other.sign(claims(Duration.ofHours(1)));

        var ex = assertThrows(TokenException.class, () -> signer.verify(token));

        assertEquals(ErrorCode.TOKEN_INVALID, ex.code());
    }

    @Test
    @DisplayName("should report expiry once the clock passes exp")
    void shouldReportExpiry() {
        var token = signer.sign(claims(Duration.ofMinutes(10)));
        clock.advance(Duration.ofMinutes(11));

        var ex = assertThrows(TokenException.class, () -> signer.verify(token));

        assertEquals(ErrorCode.TOKEN_EXPIRED, ex.code());
    }

    @Test
    @DisplayName("should reject garbage")
    void shouldRejectGarbage() {
        var ex = assertThrows(TokenException.class, () -> signer.verify("not.a.token"));

        assertEquals(ErrorCode.TOKEN_INVALID, ex.code());
    }

    @Test
    @DisplayName("should refuse to sign without a usable secret")
    void shouldRefuseShortSecret() {
        var weak = new HmacTokenSigner(new TestTokenConfig().withSigningSecret("short"), clock);

        assertThrows(IllegalStateException.class, () -> weak.sign(claims(Duration.ofHours(1))));
    }
}
