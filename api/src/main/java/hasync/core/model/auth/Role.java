package hasync.core.model.auth;

import java.util.Locale;

/**
 * Credential role. Every decision that depends on the role switches over all values.
 */
public enum Role {
    ADMIN("admin"),
    CLIENT("client");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** Lowercase name used in token claims and security roles. */
    public String value() {
        return value;
    }

    public static Role fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
