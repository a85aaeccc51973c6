package hasync.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import hasync.core.model.pairing.PairingSession;

@DisplayName("InMemoryPairingSessionRepository")
class InMemoryPairingSessionRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private InMemoryPairingSessionRepository repository;
    private PairingSession session;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPairingSessionRepository();
        session = PairingSession.pending("pair_1", "hash", "admin:admin", NOW, NOW.plusSeconds(300), 3);
        repository.saveIfAbsent(session).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should refuse a duplicate id")
    void shouldRefuseDuplicate() {
        assertFalse(repository.saveIfAbsent(session).await().atMost(TIMEOUT));
        assertEquals(1, repository.size());
    }

    @Test
    @DisplayName("should apply a compare-and-set only against the read version")
    void shouldCompareVersion() {
        var charged = session.withAttemptCharged();

        assertTrue(repository.compareAndSet(0, charged).await().atMost(TIMEOUT));
        assertFalse(repository.compareAndSet(0, charged.withAttemptCharged()).await().atMost(TIMEOUT));
        assertEquals(1, repository.findById("pair_1").await().atMost(TIMEOUT).orElseThrow().attempts());
    }

    @Test
    @DisplayName("should not resurrect a deleted session")
    void shouldNotResurrect() {
        assertTrue(repository.deleteIfVersion("pair_1", 0).await().atMost(TIMEOUT));

        assertFalse(repository.compareAndSet(0, session.withAttemptCharged()).await().atMost(TIMEOUT));
        assertTrue(repository.findById("pair_1").await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should delete only the expected version")
    void shouldDeleteExpectedVersionOnly() {
        assertFalse(repository.deleteIfVersion("pair_1", 7).await().atMost(TIMEOUT));
        assertEquals(1, repository.size());
    }
}
