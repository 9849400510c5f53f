package com.yoursp.faceapproval.service;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Random token generation for capture sessions, access sessions and access
 * codes.
 */
public final class SecureTokens {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private SecureTokens() {
        // utility class
    }

    /**
     * @param byteCount number of random bytes; the result has twice as many
     *                  lowercase hex characters
     */
    public static String hex(int byteCount) {
        byte[] bytes = new byte[byteCount];
        SECURE_RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    /** 32 hex characters. Used for capture tokens and access session ids. */
    public static String sessionToken() {
        return hex(16);
    }

    /** 12 upper-case hex characters handed to the subject at enrollment. */
    public static String accessCode() {
        return hex(6).toUpperCase(Locale.ROOT);
    }

    /** First 8 characters followed by "...", for logs and audit lines. */
    public static String abbreviate(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
