package net.tilefetch.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used to derive stable identifiers from configuration strings.
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the SHA-256 hash of a string using UTF-8 encoding and returns it as lowercase hex.
     *
     * @param data String to hash
     * @return 64-character hex digest
     * @throws NoSuchAlgorithmException If SHA-256 algorithm is not available
     */
    public static String sha256Hex(String data) throws NoSuchAlgorithmException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
    }
}
