package hasync.core.util;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Hashing helpers for secrets that must never be stored or compared in recoverable form.
 *
 * <p>Raw tokens are stored as SHA-256 digests. PINs have only six digits of entropy, so they
 * are keyed with the server secret (HMAC-SHA256) before storage. All comparisons of stored
 * digests go through {@link #constantTimeEquals(String, String)}.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private SecureHash() {}

    /**
     * Return the full SHA-256 hex digest of the input string.
     *
     * @param input the string to hash
     * @return 64 character lowercase hex digest
     */
    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(sha256(input));
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * <p>Used for log lines and rate limit keys, where an identifier must be
     * correlatable but the original value must not appear.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Return the HMAC-SHA256 hex digest of the input, keyed with the given secret.
     *
     * @param secret the key material (must not be empty)
     * @param input  the value to authenticate
     * @return 64 character lowercase hex digest
     */
    public static String hmacSha256Hex(String secret, String input) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        try {
            final var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("HmacSHA256 is required on every JVM", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("Invalid HMAC key", e);
        }
    }

    /**
     * Compare two digests in time independent of where they first differ.
     *
     * @return true if both are non-null and equal
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] sha256(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every JVM", e);
        }
    }
}
