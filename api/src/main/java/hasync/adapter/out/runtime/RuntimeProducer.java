package hasync.adapter.out.runtime;

import java.security.SecureRandom;
import java.time.Clock;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * CDI producer for the time and randomness sources.
 *
 * <p>Services take these as constructor arguments so tests can pass a fixed clock.
 */
@Singleton
public class RuntimeProducer {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
