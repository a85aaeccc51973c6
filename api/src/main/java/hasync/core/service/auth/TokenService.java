package hasync.core.service.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.config.TokenConfig;
import hasync.core.model.auth.Credential;
import hasync.core.model.auth.CredentialRevokedEvent;
import hasync.core.model.auth.IssuedToken;
import hasync.core.model.auth.Role;
import hasync.core.model.auth.ScopesChangedEvent;
import hasync.core.model.auth.TokenClaims;
import hasync.core.model.auth.TokenException;
import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;
import hasync.core.port.in.TokenManagement;
import hasync.core.port.out.CredentialRepository;
import hasync.core.port.out.TokenSigner;
import hasync.core.service.common.StorageCalls;
import hasync.core.util.SecureHash;

/**
 * Issues, verifies and revokes bearer credentials.
 *
 * <p>A raw token is a signed JWS. It is returned once to the caller of {@code issue}
 * and only its SHA-256 digest is stored. Verification checks the signature and
 * claims first, then looks the digest up and applies the stored revocation and
 * expiry state.
 *
 * <p>Revocation fires {@link CredentialRevokedEvent} synchronously, so live
 * connections of the subject are closed before the revoking call completes.
 */
@ApplicationScoped
public class TokenService implements TokenManagement {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final String SCOPE_CHANGE_REASON = "scope_change";

    private static final int TOKEN_ID_BYTES = 16;
    private static final int NONCE_BYTES = 32;
    private static final int MAX_CAS_RETRIES = 16;
    private static final int LOG_HASH_CHARS = 12;

    private final TokenConfig config;
    private final CredentialRepository repository;
    private final TokenSigner signer;
    private final Clock clock;
    private final SecureRandom random;
    private final Event<CredentialRevokedEvent> revokedEvent;
    private final Event<ScopesChangedEvent> scopesChangedEvent;

    public TokenService(
            TokenConfig config,
            CredentialRepository repository,
            TokenSigner signer,
            Clock clock,
            SecureRandom random,
            Event<CredentialRevokedEvent> revokedEvent,
            Event<ScopesChangedEvent> scopesChangedEvent) {
        this.config = config;
        this.repository = repository;
        this.signer = signer;
        this.clock = clock;
        this.random = random;
        this.revokedEvent = revokedEvent;
        this.scopesChangedEvent = scopesChangedEvent;
    }

    @Override
    public Uni<IssuedToken> issue(String subjectId, Role role, Set<String> scopes) {
        final Duration ttl = switch (role) {
            case ADMIN -> config.adminTtl();
            case CLIENT -> config.clientTtl();
        };
        return issue(subjectId, role, scopes, ttl);
    }

    @Override
    public Uni<IssuedToken> issue(String subjectId, Role role, Set<String> scopes, Duration ttl) {
        if (subjectId == null || subjectId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Subject ID is required"));
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Token TTL must be positive"));
        }

        return Uni.createFrom()
                .item(() -> mint(subjectId, role, scopes, ttl))
                .flatMap(issued -> StorageCalls.write("credential save", () -> repository.save(issued.credential()))
                        .replaceWith(issued))
                .invoke(issued -> LOG.infof(
                        "Credential issued: subject=%s, role=%s, tokenId=%s, hash=%s, expiresAt=%s",
                        subjectId,
                        role.value(),
                        issued.credential().tokenId(),
                        logHash(issued.credential().tokenHash()),
                        issued.credential().expiresAt()));
    }

    private IssuedToken mint(String subjectId, Role role, Set<String> scopes, Duration ttl) {
        // JWT dates have second precision; the stored record must match the claims
        final var issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final var claims = new TokenClaims(
                subjectId,
                randomHex(TOKEN_ID_BYTES),
                role,
                scopes,
                issuedAt,
                issuedAt.plus(ttl),
                randomBase64Url(NONCE_BYTES));

        final var rawToken = signer.sign(claims);
        final var credential = new Credential(
                SecureHash.sha256Hex(rawToken),
                claims.tokenId(),
                subjectId,
                role,
                claims.scopes(),
                claims.issuedAt(),
                claims.expiresAt(),
                null,
                null,
                null);
        return new IssuedToken(rawToken, credential);
    }

    @Override
    public Uni<Credential> verify(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Uni.createFrom().failure(TokenException.invalid("Missing token"));
        }

        return Uni.createFrom()
                .item(() -> signer.verify(rawToken))
                .flatMap(claims -> {
                    final var tokenHash = SecureHash.sha256Hex(rawToken);
                    return StorageCalls.read("credential lookup", () -> repository.findByHash(tokenHash))
                            .map(found -> {
                                if (found.isEmpty()) {
                                    LOG.debugf("Signed token with unknown hash %s", logHash(tokenHash));
                                    throw TokenException.invalid("Unknown credential");
                                }
                                return checkRecord(rawToken, claims, found.get());
                            });
                })
                .flatMap(this::recordUse);
    }

    private Credential checkRecord(String rawToken, TokenClaims claims, Credential credential) {
        if (credential.isRevoked()) {
            LOG.debugf("Rejected revoked credential %s", logHash(credential.tokenHash()));
            throw TokenException.revoked();
        }
        if (credential.isExpiredAt(clock.instant())) {
            throw TokenException.expired();
        }
        if (!credential.subjectId().equals(claims.subjectId())) {
            LOG.warnf("Credential %s subject does not match token claims", logHash(credential.tokenHash()));
            throw TokenException.invalid("Subject mismatch");
        }
        if (SecureHash.constantTimeEquals(credential.tokenHash(), rawToken)) {
            LOG.warnf("Credential for subject %s stores a raw token, rejecting", credential.subjectId());
            throw TokenException.invalid("Corrupt credential");
        }
        return credential;
    }

    private Uni<Credential> recordUse(Credential credential) {
        final var now = clock.instant();
        return repository
                .touch(credential.tokenHash(), now)
                .onFailure()
                .invoke(e -> LOG.warnf(
                        "Failed to record last use of credential %s: %s",
                        logHash(credential.tokenHash()),
                        e.getMessage()))
                .onFailure()
                .recoverWithNull()
                .replaceWith(credential.touch(now));
    }

    @Override
    public Uni<Boolean> isActive(String tokenHash) {
        return StorageCalls.read("credential lookup", () -> repository.findByHash(tokenHash))
                .map(found -> found.map(c -> c.isActiveAt(clock.instant())).orElse(false));
    }

    @Override
    public Uni<Integer> revoke(String subjectId, String reason) {
        final var now = clock.instant();
        return StorageCalls.read("credential lookup", () -> repository.findBySubject(subjectId))
                .flatMap(credentials -> {
                    if (credentials.isEmpty()) {
                        LOG.infof("Revocation requested for unknown subject %s", subjectId);
                        return Uni.createFrom().item(0);
                    }
                    return revokeAll(credentials, reason, now).invoke(count -> {
                        LOG.infof("Revoked %d credential(s) for subject %s, reason=%s", count, subjectId, reason);
                        revokedEvent.fire(CredentialRevokedEvent.forSubject(subjectId, reason, now));
                    });
                });
    }

    @Override
    public Uni<Boolean> revokeToken(String rawToken, String reason) {
        if (rawToken == null || rawToken.isBlank()) {
            return Uni.createFrom().item(false);
        }
        final var now = clock.instant();
        final var tokenHash = SecureHash.sha256Hex(rawToken);
        return StorageCalls.read("credential lookup", () -> repository.findByHash(tokenHash))
                .flatMap(found -> {
                    if (found.isEmpty() || !found.get().isActiveAt(now)) {
                        return Uni.createFrom().item(false);
                    }
                    final var credential = found.get();
                    return revokeOne(credential, reason, now, 0).invoke(revoked -> {
                        if (revoked) {
                            LOG.infof(
                                    "Revoked credential %s for subject %s, reason=%s",
                                    logHash(tokenHash),
                                    credential.subjectId(),
                                    reason);
                            revokedEvent.fire(
                                    CredentialRevokedEvent.forToken(credential.subjectId(), tokenHash, reason, now));
                        }
                    });
                });
    }

    @Override
    public Uni<IssuedToken> reissueWithScopes(String subjectId, Set<String> newScopes) {
        final var now = clock.instant();
        return StorageCalls.read("credential lookup", () -> repository.findBySubject(subjectId))
                .flatMap(credentials -> {
                    final var active = credentials.stream()
                            .filter(c -> c.role() == Role.CLIENT && c.isActiveAt(now))
                            .toList();
                    if (active.isEmpty()) {
                        return Uni.createFrom()
                                .<IssuedToken>failure(new ServiceException(
                                        ErrorCode.SUBJECT_NOT_FOUND, "No active client credential for " + subjectId));
                    }
                    final var previousScopes = active.stream()
                            .max(Comparator.comparing(Credential::issuedAt))
                            .map(Credential::assignedScopes)
                            .orElse(Set.of());

                    // old credentials stay valid until the new one exists
                    return issue(subjectId, Role.CLIENT, newScopes)
                            .call(issued -> revokeAll(active, SCOPE_CHANGE_REASON, now))
                            .invoke(issued -> {
                                LOG.infof(
                                        "Scopes changed for subject %s: %s -> %s",
                                        subjectId,
                                        previousScopes,
                                        newScopes);
                                scopesChangedEvent.fire(
                                        new ScopesChangedEvent(subjectId, previousScopes, newScopes, now));
                            });
                });
    }

    @Override
    public Uni<List<Credential>> listCredentials(String subjectId) {
        return StorageCalls.read("credential lookup", () -> repository.findBySubject(subjectId))
                .map(credentials -> credentials.stream()
                        .sorted(Comparator.comparing(Credential::issuedAt).reversed())
                        .toList());
    }

    @Override
    public Uni<Integer> purgeExpired(Instant now) {
        final var cutoff = now.minus(config.retention());
        return StorageCalls.write("credential purge", () -> repository.deleteInactiveBefore(cutoff))
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Purged %d credential(s) inactive since before %s", count, cutoff);
                    }
                });
    }

    private Uni<Integer> revokeAll(List<Credential> credentials, String reason, Instant now) {
        return Multi.createFrom()
                .iterable(credentials)
                .filter(c -> c.isActiveAt(now))
                .onItem()
                .transformToUniAndConcatenate(c -> revokeOne(c, reason, now, 0))
                .filter(Boolean::booleanValue)
                .collect()
                .asList()
                .map(List::size);
    }

    /**
     * Compare-and-set a single credential to revoked, re-reading on a lost race.
     *
     * @return true if this call revoked it, false if it was already revoked or gone
     */
    private Uni<Boolean> revokeOne(Credential current, String reason, Instant now, int attempt) {
        if (attempt >= MAX_CAS_RETRIES) {
            return Uni.createFrom()
                    .failure(new ServiceException(
                            ErrorCode.TRANSIENT_FAILURE, "Revocation kept losing races for " + current.subjectId()));
        }
        return StorageCalls.write(
                        "credential revoke", () -> repository.compareAndSet(current, current.revoke(now, reason)))
                .flatMap(applied -> {
                    if (applied) {
                        return Uni.createFrom().item(true);
                    }
                    return StorageCalls.read("credential lookup", () -> repository.findByHash(current.tokenHash()))
                            .flatMap(found -> {
                                if (found.isEmpty() || found.get().isRevoked()) {
                                    return Uni.createFrom().item(false);
                                }
                                return revokeOne(found.get(), reason, now, attempt + 1);
                            });
                });
    }

    private String randomHex(int bytes) {
        final var buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    private String randomBase64Url(int bytes) {
        final var buffer = new byte[bytes];
        random.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }

    static String logHash(String tokenHash) {
        return tokenHash.substring(0, Math.min(LOG_HASH_CHARS, tokenHash.length()));
    }
}
