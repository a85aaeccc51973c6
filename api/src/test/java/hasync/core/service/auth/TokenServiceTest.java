package hasync.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import hasync.core.model.auth.Credential;
import hasync.core.model.auth.IssuedToken;
import hasync.core.model.auth.Role;
import hasync.core.model.auth.TokenException;
import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;
import hasync.core.model.realtime.OutboundMessage;
import hasync.core.service.realtime.Connection;
import hasync.core.util.SecureHash;
import hasync.support.CoreFixture;
import hasync.support.FakeRealtimeChannel;

@DisplayName("TokenService")
class TokenServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private CoreFixture fixture;
    private TokenService service;

    @BeforeEach
    void setUp() {
        fixture = new CoreFixture();
        service = fixture.tokenService;
    }

    private IssuedToken issueClient(String subjectId, Set<String> scopes) {
        return service.issue(subjectId, Role.CLIENT, scopes).await().atMost(TIMEOUT);
    }

    private static TokenException tokenFailure(Uni<?> uni) {
        return assertThrows(TokenException.class, () -> uni.await().atMost(TIMEOUT));
    }

    private FakeRealtimeChannel connect(IssuedToken issued) {
        var channel = new FakeRealtimeChannel();
        fixture.registry.register(channel, issued.credential()).await().atMost(TIMEOUT);
        return channel;
    }

    @Nested
    @DisplayName("issue")
    class IssueTests {

        @Test
        @DisplayName("should persist only the digest of the raw token")
        void shouldPersistOnlyDigest() {
            var issued = issueClient("client_1", Set.of("kitchen"));

            var stored = fixture.credentials
                    .findByHash(SecureHash.sha256Hex(issued.rawToken()))
                    .await()
                    .atMost(TIMEOUT)
                    .orElseThrow();
            assertNotEquals(issued.rawToken(), stored.tokenHash());
            assertTrue(fixture.credentials.findByHash(issued.rawToken()).await().atMost(TIMEOUT).isEmpty());
            assertEquals(stored, issued.credential());
        }

        @Test
        @DisplayName("should use the role default lifetime")
        void shouldUseRoleLifetime() {
            var admin = service.issue("admin:admin", Role.ADMIN, Set.of()).await().atMost(TIMEOUT);
            var client = issueClient("client_1", Set.of());

            var now = fixture.clock.instant();
            assertEquals(now.plus(Duration.ofHours(8)), admin.credential().expiresAt());
            assertEquals(now.plus(Duration.ofDays(3650)), client.credential().expiresAt());
        }

        @Test
        @DisplayName("should mint distinct tokens for identical requests")
        void shouldMintDistinctTokens() {
            var first = issueClient("client_1", Set.of("kitchen"));
            var second = issueClient("client_1", Set.of("kitchen"));

            assertNotEquals(first.rawToken(), second.rawToken());
            assertNotEquals(first.credential().tokenId(), second.credential().tokenId());
        }

        @Test
        @DisplayName("should reject a blank subject")
        void shouldRejectBlankSubject() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.issue(" ", Role.CLIENT, Set.of()).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should never print the raw token")
        void shouldNotPrintRawToken() {
            var issued = issueClient("client_1", Set.of());

            assertFalse(issued.toString().contains(issued.rawToken()));
        }
    }

    @Nested
    @DisplayName("verify")
    class VerifyTests {

        @Test
        @DisplayName("should return the stored credential and record its use")
        void shouldVerifyActiveToken() {
            var issued = issueClient("client_1", Set.of("kitchen"));
            fixture.clock.advance(Duration.ofMinutes(3));

            var credential = service.verify(issued.rawToken()).await().atMost(TIMEOUT);

            assertEquals("client_1", credential.subjectId());
            assertEquals(Role.CLIENT, credential.role());
            assertEquals(Set.of("kitchen"), credential.assignedScopes());
            assertEquals(fixture.clock.instant(), credential.lastUsedAt());
        }

        @Test
        @DisplayName("should reject a missing token")
        void shouldRejectMissingToken() {
            assertEquals(ErrorCode.TOKEN_INVALID, tokenFailure(service.verify("")).code());
        }

        @Test
        @DisplayName("should reject a tampered token")
        void shouldRejectTamperedToken() {
            var raw = issueClient("client_1", Set.of()).rawToken();
            var tampered = raw.substring(0, raw.length() - 2) + (raw.endsWith("AA") ? "BB" : "AA");

            assertEquals(ErrorCode.TOKEN_INVALID, tokenFailure(service.verify(tampered)).code());
        }

        @Test
        @DisplayName("should reject a correctly signed token that was never stored")
        void shouldRejectUnknownCredential() {
            var raw = issueClient("client_1", Set.of()).rawToken();
            fixture.credentials
                    .deleteInactiveBefore(fixture.clock.instant().plus(Duration.ofDays(4000)))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(ErrorCode.TOKEN_INVALID, tokenFailure(service.verify(raw)).code());
        }

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpiredToken() {
            var raw = service.issue("admin:admin", Role.ADMIN, Set.of()).await().atMost(TIMEOUT).rawToken();
            fixture.clock.advance(Duration.ofHours(9));

            assertEquals(ErrorCode.TOKEN_EXPIRED, tokenFailure(service.verify(raw)).code());
        }
    }

    @Nested
    @DisplayName("revoke")
    class RevokeTests {

        @Test
        @DisplayName("should revoke every active credential of the subject")
        void shouldRevokeSubject() {
            var first = issueClient("client_1", Set.of());
            var second = issueClient("client_1", Set.of());
            var other = issueClient("client_2", Set.of());

            var count = service.revoke("client_1", "lost device").await().atMost(TIMEOUT);

            assertEquals(2, count);
            assertEquals(ErrorCode.TOKEN_REVOKED, tokenFailure(service.verify(first.rawToken())).code());
            assertEquals(ErrorCode.TOKEN_REVOKED, tokenFailure(service.verify(second.rawToken())).code());
            assertNotNull(service.verify(other.rawToken()).await().atMost(TIMEOUT));
            assertEquals(1, fixture.revokedEvents.fired().size());
        }

        @Test
        @DisplayName("should close the subject's live connections with 4401")
        void shouldCloseLiveConnections() {
            var issued = issueClient("client_1", Set.of("kitchen"));
            var channel = connect(issued);

            service.revoke("client_1", "lost device").await().atMost(TIMEOUT);

            assertEquals(Connection.CLOSE_REVOKED, channel.closeCode());
            var notice = assertInstanceOf(OutboundMessage.Revoked.class, channel.lastWritten());
            assertEquals("lost device", notice.reason());
            assertEquals(0, fixture.registry.count());
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            issueClient("client_1", Set.of());
            service.revoke("client_1", "first").await().atMost(TIMEOUT);

            var count = service.revoke("client_1", "second").await().atMost(TIMEOUT);

            assertEquals(0, count);
            var stored = service.listCredentials("client_1").await().atMost(TIMEOUT).get(0);
            assertEquals("first", stored.revokeReason());
        }

        @Test
        @DisplayName("should return zero for an unknown subject without firing")
        void shouldIgnoreUnknownSubject() {
            var count = service.revoke("client_missing", "x").await().atMost(TIMEOUT);

            assertEquals(0, count);
            assertTrue(fixture.revokedEvents.fired().isEmpty());
        }

        @Test
        @DisplayName("should revoke a single token and close only its connections")
        void shouldRevokeSingleToken() {
            var admin1 = service.issue("admin:admin", Role.ADMIN, Set.of()).await().atMost(TIMEOUT);
            var admin2 = service.issue("admin:admin", Role.ADMIN, Set.of()).await().atMost(TIMEOUT);
            var first = connect(admin1);
            var second = connect(admin2);

            assertTrue(service.revokeToken(admin1.rawToken(), "logout").await().atMost(TIMEOUT));

            assertEquals(Connection.CLOSE_REVOKED, first.closeCode());
            assertFalse(second.isClosed());
            assertNotNull(service.verify(admin2.rawToken()).await().atMost(TIMEOUT));
            assertFalse(service.revokeToken(admin1.rawToken(), "logout").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("reissueWithScopes")
    class ReissueTests {

        @Test
        @DisplayName("should replace the credential and keep sockets open with new scopes")
        void shouldReissue() {
            var original = issueClient("client_1", Set.of("kitchen"));
            var channel = connect(original);

            var reissued = service.reissueWithScopes("client_1", Set.of("garage")).await().atMost(TIMEOUT);

            assertEquals(Set.of("garage"), reissued.credential().assignedScopes());
            assertEquals(ErrorCode.TOKEN_REVOKED, tokenFailure(service.verify(original.rawToken())).code());
            assertNotNull(service.verify(reissued.rawToken()).await().atMost(TIMEOUT));

            assertFalse(channel.isClosed());
            var changed = assertInstanceOf(OutboundMessage.ScopeChanged.class, channel.lastWritten());
            assertEquals(Set.of("garage"), changed.scopes());
            assertEquals(Set.of("garage"), changed.added());
            assertEquals(Set.of("kitchen"), changed.removed());

            var event = fixture.scopeEvents.fired().get(0);
            assertEquals(Set.of("kitchen"), event.previousScopes());
            assertTrue(fixture.revokedEvents.fired().isEmpty());
        }

        @Test
        @DisplayName("should fail for a subject without an active client credential")
        void shouldFailWithoutActiveCredential() {
            var ex = assertThrows(
                    ServiceException.class,
                    () -> service.reissueWithScopes("client_missing", Set.of()).await().atMost(TIMEOUT));

            assertEquals(ErrorCode.SUBJECT_NOT_FOUND, ex.code());
        }
    }

    @Nested
    @DisplayName("retention")
    class RetentionTests {

        @Test
        @DisplayName("should purge credentials revoked before the retention period")
        void shouldPurgeOldRevokedCredentials() {
            issueClient("client_1", Set.of());
            var keep = issueClient("client_2", Set.of());
            service.revoke("client_1", "gone").await().atMost(TIMEOUT);
            fixture.clock.advance(Duration.ofDays(31));

            var purged = service.purgeExpired(fixture.clock.instant()).await().atMost(TIMEOUT);

            assertEquals(1, purged);
            assertTrue(service.listCredentials("client_1").await().atMost(TIMEOUT).isEmpty());
            Credential remaining = service.listCredentials("client_2").await().atMost(TIMEOUT).get(0);
            assertEquals(keep.credential().tokenHash(), remaining.tokenHash());
            assertNull(remaining.revokedAt());
        }

        @Test
        @DisplayName("should keep recently revoked credentials")
        void shouldKeepRecentlyRevoked() {
            issueClient("client_1", Set.of());
            service.revoke("client_1", "gone").await().atMost(TIMEOUT);

            assertEquals(0, service.purgeExpired(fixture.clock.instant()).await().atMost(TIMEOUT));
        }
    }
}
