package hasync.support;

import java.security.SecureRandom;
import java.util.Set;

import hasync.adapter.out.auth.HmacTokenSigner;
import hasync.adapter.out.storage.memory.InMemoryCredentialRepository;
import hasync.adapter.out.storage.memory.InMemoryPairedClientRepository;
import hasync.adapter.out.storage.memory.InMemoryPairingSessionRepository;
import hasync.adapter.out.storage.memory.InMemoryScopeRegistry;
import hasync.core.model.auth.CredentialRevokedEvent;
import hasync.core.model.auth.ScopesChangedEvent;
import hasync.core.service.auth.TokenService;
import hasync.core.service.client.ClientService;
import hasync.core.service.pairing.PairingService;
import hasync.core.service.pairing.PinGenerator;
import hasync.core.service.pairing.PinHasher;
import hasync.core.service.realtime.ConnectionRegistry;
import hasync.core.service.realtime.EventBroadcaster;

/**
 * The core services wired by hand over in-memory adapters and a {@link MutableClock},
 * with credential events delivered synchronously to the broadcaster as CDI would.
 */
public class CoreFixture {

    public static final Set<String> KNOWN_SCOPES = Set.of("kitchen", "living_room", "garage");

    public final MutableClock clock = MutableClock.startingAt("2025-01-15T10:00:00Z");
    public final SecureRandom random = new SecureRandom();
    public final TestConfigs.TestPairingConfig pairingConfig;
    public final TestConfigs.TestTokenConfig tokenConfig = new TestConfigs.TestTokenConfig();
    public final TestConfigs.TestRealtimeConfig realtimeConfig;

    public final InMemoryPairingSessionRepository sessions = new InMemoryPairingSessionRepository();
    public final InMemoryCredentialRepository credentials = new InMemoryCredentialRepository();
    public final InMemoryPairedClientRepository clients = new InMemoryPairedClientRepository();
    public final InMemoryScopeRegistry scopes = new InMemoryScopeRegistry(KNOWN_SCOPES);

    public final RecordingEvent<CredentialRevokedEvent> revokedEvents = new RecordingEvent<>();
    public final RecordingEvent<ScopesChangedEvent> scopeEvents = new RecordingEvent<>();

    public final HmacTokenSigner signer;
    public final TokenService tokenService;
    public final PinHasher pinHasher;
    public final PairingService pairingService;
    public final ClientService clientService;
    public final ConnectionRegistry registry;
    public final EventBroadcaster broadcaster;

    public CoreFixture() {
        this(new TestConfigs.TestPairingConfig(), new TestConfigs.TestRealtimeConfig());
    }

    public CoreFixture(TestConfigs.TestPairingConfig pairingConfig, TestConfigs.TestRealtimeConfig realtimeConfig) {
        this.pairingConfig = pairingConfig;
        this.realtimeConfig = realtimeConfig;
        this.signer = new HmacTokenSigner(tokenConfig, clock);
        this.tokenService =
                new TokenService(tokenConfig, credentials, signer, clock, random, revokedEvents, scopeEvents);
        this.pinHasher = new PinHasher(tokenConfig);
        this.pairingService = new PairingService(
                pairingConfig,
                sessions,
                clients,
                scopes,
                tokenService,
                new PinGenerator(random),
                pinHasher,
                random,
                clock);
        this.clientService = new ClientService(clients, scopes, tokenService, clock);
        this.registry = new ConnectionRegistry(tokenService, realtimeConfig, clock);
        this.broadcaster = new EventBroadcaster(registry);
        revokedEvents.observeWith(broadcaster::onRevocation);
        scopeEvents.observeWith(broadcaster::onScopeChange);
    }
}
