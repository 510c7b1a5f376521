package canopy.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hashes client identities before they reach log output.
 *
 * <p>The same client always maps to the same short digest, so log lines can be
 * correlated without exposing the raw identity.
 */
public final class ClientIdHash {

    private static final int LOG_HEX_CHARS = 12;
    private static final int MAX_HEX_CHARS = 64;

    private ClientIdHash() {}

    /**
     * Digest suitable for log messages.
     *
     * @param clientId the client identity, may be null
     * @return 12 hex characters, or {@code "none"} for a null identity
     */
    public static String forLog(String clientId) {
        return clientId == null ? "none" : truncatedSha256(clientId, LOG_HEX_CHARS);
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
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
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes).substring(0, hexChars);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 must be available", e);
        }
    }
}
