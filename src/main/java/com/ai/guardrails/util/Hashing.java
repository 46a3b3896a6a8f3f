package com.ai.guardrails.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashing {

    private Hashing() {}

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of the given parts, joined by {@code '|'}.
     */
    public static String sha256Hex(String... parts) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JVM ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hash);
    }

    /**
     * Stable fingerprint of an authorization-style decision, suitable as a cache key.
     */
    public static String decisionFingerprint(String subject, String action, String resource) {
        return sha256Hex(nullToEmpty(subject), nullToEmpty(action), nullToEmpty(resource));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
