package hasync.core.service.pairing;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.config.PairingConfig;
import hasync.core.model.auth.Role;
import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;
import hasync.core.model.pairing.CleanupResult;
import hasync.core.model.pairing.DeviceType;
import hasync.core.model.pairing.PairedClient;
import hasync.core.model.pairing.PairingCompletion;
import hasync.core.model.pairing.PairingException;
import hasync.core.model.pairing.PairingSession;
import hasync.core.model.pairing.PairingSessionCreated;
import hasync.core.model.pairing.PairingStatus;
import hasync.core.port.in.PairingManagement;
import hasync.core.port.in.TokenManagement;
import hasync.core.port.out.PairedClientRepository;
import hasync.core.port.out.PairingSessionRepository;
import hasync.core.port.out.ScopeRegistry;
import hasync.core.service.common.StorageCalls;
import hasync.core.util.SecureHash;

/**
 * PIN pairing state machine.
 *
 * <p>Every transition is a compare-and-set on the session version. A caller that
 * loses the race re-reads the session and evaluates it again, so concurrent
 * verifications of one PIN produce exactly one success, a verification racing a
 * cancellation sees the cancelled state, and no wrong-PIN attempt is lost.
 */
@ApplicationScoped
public class PairingService implements PairingManagement {

    private static final Logger LOG = Logger.getLogger(PairingService.class);

    static final String SESSION_ID_PREFIX = "pair_";
    static final String SUBJECT_ID_PREFIX = "client_";

    private static final int SESSION_ID_BYTES = 16;
    private static final int SUBJECT_ID_BYTES = 12;
    private static final int MAX_CAS_RETRIES = 32;
    private static final String DEFAULT_CLIENT_NAME = "Device";

    private final PairingConfig config;
    private final PairingSessionRepository sessions;
    private final PairedClientRepository clients;
    private final ScopeRegistry scopeRegistry;
    private final TokenManagement tokens;
    private final PinGenerator pinGenerator;
    private final PinHasher pinHasher;
    private final SecureRandom random;
    private final Clock clock;

    public PairingService(
            PairingConfig config,
            PairingSessionRepository sessions,
            PairedClientRepository clients,
            ScopeRegistry scopeRegistry,
            TokenManagement tokens,
            PinGenerator pinGenerator,
            PinHasher pinHasher,
            SecureRandom random,
            Clock clock) {
        this.config = config;
        this.sessions = sessions;
        this.clients = clients;
        this.scopeRegistry = scopeRegistry;
        this.tokens = tokens;
        this.pinGenerator = pinGenerator;
        this.pinHasher = pinHasher;
        this.random = random;
        this.clock = clock;
    }

    // ========== Create ==========

    @Override
    public Uni<PairingSessionCreated> createSession(String createdBy) {
        final var now = clock.instant();
        return createWithRetry(createdBy, now, now.plus(config.pinTtl()), 0);
    }

    private Uni<PairingSessionCreated> createWithRetry(String createdBy, Instant now, Instant expiresAt, int attempt) {
        final var maxRetries = config.pinCollisionRetries();
        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new ServiceException(
                            ErrorCode.TRANSIENT_FAILURE,
                            "Failed to generate a unique PIN after " + maxRetries + " attempts"));
        }

        final var pin = pinGenerator.generate();
        final var pinHash = pinHasher.hash(pin);

        return StorageCalls.read("session scan", sessions::findAll).flatMap(existing -> {
            final var collides = existing.stream()
                    .anyMatch(s -> s.status().isOpen()
                            && !s.isExpiredAt(now)
                            && SecureHash.constantTimeEquals(s.pinHash(), pinHash));
            if (collides) {
                LOG.warnf("PIN collision with an open session (attempt %d/%d), retrying", attempt + 1, maxRetries);
                return createWithRetry(createdBy, now, expiresAt, attempt + 1);
            }

            final var session = PairingSession.pending(
                    newId(SESSION_ID_PREFIX, SESSION_ID_BYTES),
                    pinHash,
                    createdBy,
                    now,
                    expiresAt,
                    config.maxAttempts());
            return StorageCalls.write("session save", () -> sessions.saveIfAbsent(session))
                    .flatMap(saved -> {
                        if (!saved) {
                            LOG.warnf("Session ID collision (attempt %d/%d), retrying", attempt + 1, maxRetries);
                            return createWithRetry(createdBy, now, expiresAt, attempt + 1);
                        }
                        LOG.infof(
                                "Pairing session created: %s by %s, expires at %s",
                                session.id(),
                                createdBy,
                                expiresAt);
                        return Uni.createFrom().item(new PairingSessionCreated(session.id(), pin, expiresAt));
                    });
        });
    }

    // ========== Verify ==========

    @Override
    public Uni<String> verifySession(
            String pin, String deviceName, DeviceType deviceType, Optional<String> sessionIdHint) {
        if (!PinGenerator.isWellFormed(pin)) {
            return Uni.createFrom().failure(new PairingException(ErrorCode.INVALID_PIN, "Malformed PIN"));
        }

        final var now = clock.instant();
        final var pinHash = pinHasher.hash(pin);
        final var type = deviceType != null ? deviceType : DeviceType.OTHER;

        return candidates(sessionIdHint).flatMap(candidates -> {
            PairingSession match = null;
            // compare every candidate, no early exit
            for (PairingSession candidate : candidates) {
                final var equal = SecureHash.constantTimeEquals(candidate.pinHash(), pinHash);
                if (equal && (match == null || (!match.status().isOpen() && candidate.status().isOpen()))) {
                    match = candidate;
                }
            }

            if (match != null) {
                return verifyMatch(match.id(), deviceName, type, now, 0);
            }
            return chargeWrongPin(candidates, sessionIdHint.isPresent(), now);
        });
    }

    private Uni<List<PairingSession>> candidates(Optional<String> sessionIdHint) {
        if (sessionIdHint.isPresent()) {
            final var hint = sessionIdHint.get();
            return StorageCalls.read("session lookup", () -> sessions.findById(hint))
                    .map(found -> found.map(List::of).orElse(List.of()));
        }
        return StorageCalls.read("session scan", sessions::findAll);
    }

    private Uni<String> verifyMatch(
            String sessionId, String deviceName, DeviceType deviceType, Instant now, int attempt) {
        if (attempt >= MAX_CAS_RETRIES) {
            return Uni.createFrom().failure(contention(sessionId));
        }

        return StorageCalls.read("session lookup", () -> sessions.findById(sessionId))
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom()
                                .<String>failure(new PairingException(ErrorCode.INVALID_PIN, "Session disappeared"));
                    }
                    final var session = found.get();

                    if (session.status() == PairingStatus.EXPIRED) {
                        return Uni.createFrom().<String>failure(PairingException.expired(sessionId));
                    }
                    if (session.isExpiredAt(now)) {
                        return markExpired(session).flatMap(ignored -> Uni.createFrom()
                                .<String>failure(PairingException.expired(sessionId)));
                    }
                    if (session.isLocked()) {
                        LOG.warnf("Correct PIN presented for locked session %s", sessionId);
                        return Uni.createFrom().<String>failure(PairingException.locked(sessionId));
                    }
                    if (session.status() != PairingStatus.PENDING) {
                        return Uni.createFrom().<String>failure(PairingException.alreadyUsed(sessionId));
                    }

                    final var verified = session.verified(deviceName, deviceType, now);
                    return StorageCalls.write(
                                    "session verify", () -> sessions.compareAndSet(session.version(), verified))
                            .flatMap(applied -> {
                                if (!applied) {
                                    LOG.debugf("Lost verify race on session %s, re-evaluating", sessionId);
                                    return verifyMatch(sessionId, deviceName, deviceType, now, attempt + 1);
                                }
                                LOG.infof(
                                        "Pairing session verified: %s, device=%s (%s)",
                                        sessionId,
                                        deviceName,
                                        deviceType.value());
                                return Uni.createFrom().item(sessionId);
                            });
                });
    }

    /**
     * Only the session named by the hint is charged. Without a hint no session is
     * charged and the per-address rate limit is the only bound on guessing.
     */
    private Uni<String> chargeWrongPin(List<PairingSession> candidates, boolean hinted, Instant now) {
        if (!hinted || candidates.isEmpty()) {
            LOG.warn("Wrong PIN entered without a known session");
            return Uni.createFrom().failure(new PairingException(ErrorCode.INVALID_PIN, "PIN did not match"));
        }

        final var target = candidates.get(0);
        if (target.isLocked()) {
            return Uni.createFrom().failure(PairingException.locked(target.id()));
        }

        return chargeAttempt(target.id(), now, 0).flatMap(charged -> {
            final OptionalInt remaining = charged.map(s -> OptionalInt.of(s.attemptsRemaining()))
                    .orElse(OptionalInt.empty());
            LOG.warnf("Wrong PIN entered for session %s", target.id());

            if (remaining.isPresent() && remaining.getAsInt() == 0) {
                return Uni.createFrom()
                        .<String>failure(new PairingException(
                                ErrorCode.MAX_ATTEMPTS_EXCEEDED, "Maximum attempts exceeded", 0));
            }
            return Uni.createFrom()
                    .<String>failure(new PairingException(
                            ErrorCode.INVALID_PIN,
                            "PIN did not match",
                            remaining.isPresent() ? remaining.getAsInt() : null));
        });
    }

    /**
     * Charge one wrong attempt to a session, retrying the compare-and-set until it applies.
     *
     * @return the charged session, or empty if it no longer accepts attempts
     */
    private Uni<Optional<PairingSession>> chargeAttempt(String sessionId, Instant now, int attempt) {
        if (attempt >= MAX_CAS_RETRIES) {
            return Uni.createFrom().failure(contention(sessionId));
        }

        return StorageCalls.read("session lookup", () -> sessions.findById(sessionId))
                .flatMap(found -> {
                    if (found.isEmpty() || !found.get().acceptsAttempts(now)) {
                        return Uni.createFrom().item(Optional.<PairingSession>empty());
                    }
                    final var current = found.get();
                    final var charged = current.withAttemptCharged();
                    return StorageCalls.write(
                                    "session attempt", () -> sessions.compareAndSet(current.version(), charged))
                            .flatMap(applied -> applied
                                    ? Uni.createFrom().item(Optional.of(charged))
                                    : chargeAttempt(sessionId, now, attempt + 1));
                });
    }

    // ========== Complete ==========

    @Override
    public Uni<PairingCompletion> completeSession(
            String sessionId, String clientName, Set<String> assignedScopes, String completedBy) {
        final var scopes = assignedScopes == null ? Set.<String>of() : Set.copyOf(assignedScopes);
        final var now = clock.instant();

        return requireSession(sessionId)
                .invoke(session -> checkCompletable(session, now))
                .call(session -> scopeRegistry.unknown(scopes).invoke(unknown -> {
                    if (!unknown.isEmpty()) {
                        throw new ServiceException(ErrorCode.SCOPE_NOT_FOUND, "Unknown scopes: " + unknown);
                    }
                }))
                .flatMap(session -> claim(session, now, 0))
                .flatMap(claimed -> issueClientCredential(claimed, clientName, scopes, completedBy, now));
    }

    private void checkCompletable(PairingSession session, Instant now) {
        switch (session.status()) {
            case EXPIRED -> throw PairingException.expired(session.id());
            case COMPLETED -> throw PairingException.alreadyUsed(session.id());
            case PENDING -> {
                if (session.isExpiredAt(now)) {
                    throw PairingException.expired(session.id());
                }
                throw PairingException.notVerified(session.id());
            }
            case VERIFIED -> {
                if (session.isExpiredAt(now)) {
                    throw PairingException.expired(session.id());
                }
            }
        }
    }

    private Uni<PairingSession> claim(PairingSession session, Instant now, int attempt) {
        if (attempt >= MAX_CAS_RETRIES) {
            return Uni.createFrom().failure(contention(session.id()));
        }
        final var completed = session.completed(now);
        return StorageCalls.write("session complete", () -> sessions.compareAndSet(session.version(), completed))
                .flatMap(applied -> {
                    if (applied) {
                        return Uni.createFrom().item(completed);
                    }
                    return requireSession(session.id())
                            .invoke(fresh -> checkCompletable(fresh, now))
                            .flatMap(fresh -> claim(fresh, now, attempt + 1));
                });
    }

    private Uni<PairingCompletion> issueClientCredential(
            PairingSession session, String clientName, Set<String> scopes, String completedBy, Instant now) {
        final var subjectId = newId(SUBJECT_ID_PREFIX, SUBJECT_ID_BYTES);
        final var client = new PairedClient(
                subjectId,
                displayName(clientName, session.deviceName()),
                session.deviceName(),
                session.deviceType(),
                session.id(),
                completedBy,
                now);

        return tokens.issue(subjectId, Role.CLIENT, scopes)
                .call(issued -> StorageCalls.write("client save", () -> clients.save(client)))
                .map(issued -> new PairingCompletion(client, issued))
                .invoke(completion -> LOG.infof(
                        "Pairing session completed: %s -> %s (%s), scopes=%s",
                        session.id(),
                        subjectId,
                        client.clientName(),
                        scopes))
                .onFailure()
                .invoke(e -> LOG.errorf(
                        e, "Pairing session %s was claimed but credential issuance failed", session.id()));
    }

    // ========== Cancel / Read ==========

    @Override
    public Uni<Void> cancelSession(String sessionId, String cancelledBy) {
        return requireSession(sessionId).flatMap(session -> cancel(session, cancelledBy, 0));
    }

    private Uni<Void> cancel(PairingSession session, String cancelledBy, int attempt) {
        if (attempt >= MAX_CAS_RETRIES) {
            return Uni.createFrom().failure(contention(session.id()));
        }
        return switch (session.status()) {
            case COMPLETED -> Uni.createFrom().failure(PairingException.alreadyUsed(session.id()));
            case EXPIRED -> Uni.createFrom().voidItem();
            case PENDING, VERIFIED -> StorageCalls.write(
                            "session cancel", () -> sessions.compareAndSet(session.version(), session.expired(true)))
                    .flatMap(applied -> {
                        if (applied) {
                            LOG.infof("Pairing session cancelled: %s by %s", session.id(), cancelledBy);
                            return Uni.createFrom().voidItem();
                        }
                        return requireSession(session.id()).flatMap(fresh -> cancel(fresh, cancelledBy, attempt + 1));
                    });
        };
    }

    @Override
    public Uni<PairingSession> getSession(String sessionId) {
        return requireSession(sessionId);
    }

    private Uni<PairingSession> requireSession(String sessionId) {
        return StorageCalls.read("session lookup", () -> sessions.findById(sessionId))
                .map(found -> found.orElseThrow(() -> PairingException.notFound(sessionId)));
    }

    // ========== Cleanup ==========

    private enum SweepOutcome {
        EXPIRED,
        DELETED,
        UNCHANGED
    }

    @Override
    public Uni<CleanupResult> cleanupExpired(Instant now) {
        final var deleteBefore = now.minus(config.retention());

        return StorageCalls.read("session scan", sessions::findAll)
                .flatMap(all -> Multi.createFrom()
                        .iterable(all)
                        .onItem()
                        .transformToUniAndConcatenate(session -> sweep(session, now, deleteBefore))
                        .collect()
                        .asList())
                .map(outcomes -> new CleanupResult(
                        (int) outcomes.stream().filter(o -> o == SweepOutcome.EXPIRED).count(),
                        (int) outcomes.stream().filter(o -> o == SweepOutcome.DELETED).count()));
    }

    private Uni<SweepOutcome> sweep(PairingSession session, Instant now, Instant deleteBefore) {
        if (session.status().isOpen() && session.isExpiredAt(now)) {
            // a row that changed concurrently is left for the next sweep
            return StorageCalls.write(
                            "session expire", () -> sessions.compareAndSet(session.version(), session.expired(false)))
                    .map(applied -> applied ? SweepOutcome.EXPIRED : SweepOutcome.UNCHANGED);
        }
        if (session.status().isTerminal() && session.retentionAnchor().isBefore(deleteBefore)) {
            return StorageCalls.write(
                            "session delete", () -> sessions.deleteIfVersion(session.id(), session.version()))
                    .map(deleted -> deleted ? SweepOutcome.DELETED : SweepOutcome.UNCHANGED);
        }
        return Uni.createFrom().item(SweepOutcome.UNCHANGED);
    }

    // ========== Helpers ==========

    private Uni<Boolean> markExpired(PairingSession session) {
        if (!session.status().isOpen()) {
            return Uni.createFrom().item(false);
        }
        return StorageCalls.write(
                "session expire", () -> sessions.compareAndSet(session.version(), session.expired(false)));
    }

    private ServiceException contention(String sessionId) {
        LOG.warnf("Gave up after %d compare-and-set attempts on session %s", MAX_CAS_RETRIES, sessionId);
        return new ServiceException(ErrorCode.TRANSIENT_FAILURE, "Too much contention on session " + sessionId);
    }

    private String newId(String prefix, int bytes) {
        final var buffer = new byte[bytes];
        random.nextBytes(buffer);
        return prefix + HexFormat.of().formatHex(buffer);
    }

    private static String displayName(String clientName, String deviceName) {
        if (clientName != null && !clientName.isBlank()) {
            return clientName.trim();
        }
        if (deviceName != null && !deviceName.isBlank()) {
            return deviceName;
        }
        return DEFAULT_CLIENT_NAME;
    }
}
