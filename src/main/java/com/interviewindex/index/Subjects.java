package com.interviewindex.index;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class Subjects {
    private static final int MAX_PREFIX_LENGTH = 48;

    private Subjects() {
    }

    /**
     * Stable key for a subject name: trimmed, lower-cased, whitespace collapsed to {@code _}.
     */
    public static String key(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("subject name must not be blank");
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    /**
     * File name stem for a key: a readable prefix of the file-safe characters followed by the
     * first 16 hex digits of the key's SHA-256, so distinct keys never share a file.
     */
    public static String fileName(String key) {
        String prefix = key.replaceAll("[^a-z0-9._-]", "-");
        if (prefix.length() > MAX_PREFIX_LENGTH) {
            prefix = prefix.substring(0, MAX_PREFIX_LENGTH);
        }
        return prefix + "-" + digest(key).substring(0, 16);
    }

    private static String digest(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
