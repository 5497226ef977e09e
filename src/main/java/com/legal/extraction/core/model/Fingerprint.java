package com.legal.extraction.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic short SHA-256 fingerprints used for candidate ids and fallback keys.
 */
public final class Fingerprint {

    private static final HexFormat HEX = HexFormat.of();

    private Fingerprint() {
    }

    /**
     * Hashes the parts joined by a unit separator and returns the first {@code hexLength} hex chars.
     */
    public static String of(int hexLength, Object... parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append('\u001f');
            }
            joined.append(parts[i]);
        }
        byte[] digest = sha256().digest(joined.toString().getBytes(StandardCharsets.UTF_8));
        String hex = HEX.formatHex(digest);
        return hex.substring(0, Math.min(hexLength, hex.length()));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
