package com.williamcallahan.crossref.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hex digests used for deterministic id suffixes.
 */
public final class ContentHasher {

    private ContentHasher() {}

    /**
     * Generates an MD5 hex digest for the given text.
     *
     * @param text the text to hash
     * @return lowercase hexadecimal digest (32 characters)
     */
    public static String md5Hex(String text) {
        return hex("MD5", text);
    }

    /**
     * Returns the first {@code length} hex characters of the MD5 digest of {@code text}.
     *
     * @param text the text to hash
     * @param length number of hex characters, 1..32
     * @return digest prefix
     */
    public static String shortDigest(String text, int length) {
        if (length < 1 || length > 32) {
            throw new IllegalArgumentException("Digest length must be between 1 and 32: " + length);
        }
        return md5Hex(text).substring(0, length);
    }

    private static String hex(String algorithm, String text) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
