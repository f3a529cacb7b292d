package com.williamcallahan.reverse_image_search.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex digests used to derive stable identifiers
 *
 * @author William Callahan
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class
    }

    public static String sha1Hex(String value) {
        return hex("SHA-1", value);
    }

    public static String sha256Hex(String value) {
        return hex("SHA-256", value);
    }

    private static String hex(String algorithm, String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-1 and SHA-256
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
