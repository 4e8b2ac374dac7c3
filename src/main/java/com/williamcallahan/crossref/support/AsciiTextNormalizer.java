package com.williamcallahan.crossref.support;

import java.text.Normalizer;

/**
 * Provides locale-independent text normalization for identifiers, class names and sort keys.
 *
 * Case folding here only touches ASCII letters (A-Z), so markup class names and id fragments
 * compare the same way regardless of the JVM default locale.
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Decomposes text (NFD) and drops combining marks, so "Café" becomes "Cafe".
     *
     * @param text the input text (may be null)
     * @return text without diacritics, or empty string if null
     */
    public static String stripDiacritics(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        StringBuilder stripped = new StringBuilder(decomposed.length());
        for (int index = 0; index < decomposed.length(); index++) {
            char current = decomposed.charAt(index);
            if (Character.getType(current) != Character.NON_SPACING_MARK) {
                stripped.append(current);
            }
        }
        return stripped.toString();
    }

    /**
     * Builds an ASCII slug: diacritics removed, characters outside {@code [A-Za-z0-9_ -]} dropped,
     * whitespace runs turned into single hyphens, repeated hyphens collapsed, lowercased.
     *
     * @param text the input text (may be null)
     * @return slug, possibly empty
     */
    public static String slugify(String text) {
        String ascii = stripDiacritics(text);
        StringBuilder slug = new StringBuilder(ascii.length());
        boolean pendingHyphen = false;
        for (int index = 0; index < ascii.length(); index++) {
            char current = ascii.charAt(index);
            if (Character.isWhitespace(current) || current == '-') {
                pendingHyphen = slug.length() > 0;
                continue;
            }
            boolean asciiWordChar = (current >= 'a' && current <= 'z')
                    || (current >= 'A' && current <= 'Z')
                    || (current >= '0' && current <= '9')
                    || current == '_';
            if (!asciiWordChar) {
                continue;
            }
            if (pendingHyphen) {
                slug.append('-');
                pendingHyphen = false;
            }
            slug.append(current);
        }
        return toLowerAscii(slug.toString());
    }

    /**
     * Collapses whitespace runs to single spaces and trims.
     *
     * @param text the input text (may be null)
     * @return collapsed text, or empty string if null
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder collapsed = new StringBuilder(text.length());
        boolean inWhitespace = false;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (Character.isWhitespace(current) || current == '\u00A0') {
                inWhitespace = collapsed.length() > 0;
                continue;
            }
            if (inWhitespace) {
                collapsed.append(' ');
                inWhitespace = false;
            }
            collapsed.append(current);
        }
        return collapsed.toString();
    }
}
