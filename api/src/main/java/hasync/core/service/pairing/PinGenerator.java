package hasync.core.service.pairing;

import java.security.SecureRandom;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Draws six digit PINs uniformly from 100000-999999 using a cryptographically
 * secure source.
 */
@ApplicationScoped
public class PinGenerator {

    static final int PIN_MIN = 100_000;
    static final int PIN_RANGE = 900_000;
    static final int PIN_LENGTH = 6;

    private final SecureRandom random;

    public PinGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        return Integer.toString(PIN_MIN + random.nextInt(PIN_RANGE));
    }

    /**
     * Whether {@code pin} is exactly six ASCII digits.
     */
    public static boolean isWellFormed(String pin) {
        if (pin == null || pin.length() != PIN_LENGTH) {
            return false;
        }
        for (int i = 0; i < PIN_LENGTH; i++) {
            final var c = pin.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
