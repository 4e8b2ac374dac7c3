package com.williamcallahan.crossref.service.anchor;

import com.williamcallahan.crossref.support.AsciiTextNormalizer;
import com.williamcallahan.crossref.support.ContentHasher;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Derives readable ids and disambiguates them with short content-hash suffixes.
 *
 * <p>A derived id reads {@code {prefix}-{label}-{slug}} and is cut so that a suffix
 * ({@code -} plus {@code suffixLength} hex characters) still fits the maximum length.
 * On collision the candidate becomes {@code {base}-{md5("{base}-{attempt}")[0..n]}} with
 * the attempt counting up from 1.</p>
 *
 * <p>Not thread-safe; owned by one registry writer.</p>
 */
public final class AnchorIdGenerator {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

    private final String prefix;
    private final int maxIdLength;
    private final int suffixLength;
    private final int maxAttempts;
    // attempts already consumed per base; ids are never released so earlier attempts stay taken
    private final Map<String, Integer> attemptsByBase = new HashMap<>();

    /**
     * Creates a generator.
     *
     * @param prefix first id segment
     * @param maxIdLength upper bound for generated ids including the suffix
     * @param suffixLength hex characters per collision suffix
     * @param maxAttempts cap on suffixed candidates per base id
     */
    public AnchorIdGenerator(String prefix, int maxIdLength, int suffixLength, int maxAttempts) {
        if (!isSafeId(prefix)) {
            throw new IllegalArgumentException("Id prefix must match [A-Za-z][A-Za-z0-9_-]*: " + prefix);
        }
        if (suffixLength < 1 || suffixLength > 32) {
            throw new IllegalArgumentException("Suffix length must be between 1 and 32");
        }
        if (maxIdLength <= prefix.length() + suffixLength + 1) {
            throw new IllegalArgumentException("Max id length leaves no room for content: " + maxIdLength);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.prefix = prefix;
        this.maxIdLength = maxIdLength;
        this.suffixLength = suffixLength;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Whether a string can be used as an id verbatim.
     */
    public static boolean isSafeId(String candidate) {
        return candidate != null && SAFE_ID.matcher(candidate).matches();
    }

    /**
     * Derives the base id for a kind label and fallback content.
     *
     * @param label kind label, the middle segment
     * @param content text to slugify; blank content yields {@code {prefix}-{label}}
     * @return a safe id that leaves room for a collision suffix
     */
    public String deriveBase(String label, String content) {
        String slug = AsciiTextNormalizer.slugify(content);
        String base = slug.isEmpty() ? prefix + "-" + label : prefix + "-" + label + "-" + slug;
        int limit = maxIdLength - suffixLength - 1;
        if (base.length() > limit) {
            base = base.substring(0, limit);
        }
        while (base.endsWith("-")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    /**
     * Returns the base itself when free, otherwise the first free suffixed candidate.
     *
     * @param base id to disambiguate
     * @param taken tells whether a candidate is already registered
     * @return free id
     * @throws IdCollisionExhaustedException when every attempt up to the cap collides
     */
    public String disambiguate(String base, Predicate<String> taken) {
        if (!taken.test(base)) {
            return base;
        }
        String stem = fitStem(base);
        int attempt = attemptsByBase.getOrDefault(base, 0);
        while (attempt < maxAttempts) {
            attempt++;
            String candidate = stem + "-" + ContentHasher.shortDigest(base + "-" + attempt, suffixLength);
            if (!taken.test(candidate)) {
                attemptsByBase.put(base, attempt);
                return candidate;
            }
        }
        attemptsByBase.put(base, attempt);
        throw new IdCollisionExhaustedException(base, maxAttempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    // Adopted author ids can be longer than derived ones; the suffixed form still honors the maximum.
    private String fitStem(String base) {
        int limit = maxIdLength - suffixLength - 1;
        if (base.length() <= limit) {
            return base;
        }
        String stem = base.substring(0, limit);
        while (stem.endsWith("-") && stem.length() > 1) {
            stem = stem.substring(0, stem.length() - 1);
        }
        return stem;
    }
}
