package com.williamcallahan.crossref.service.index;

import com.williamcallahan.crossref.domain.index.IndexSection;
import com.williamcallahan.crossref.service.EngineOptions.IndexOptions;
import com.williamcallahan.crossref.support.AsciiTextNormalizer;
import java.util.List;
import java.util.Locale;

/**
 * Derives the keys an index entry is merged, ordered and sectioned by.
 * Display text is never passed back out of here.
 */
public final class SortKeyNormalizer {

    private final Locale locale;
    private final boolean caseSensitive;
    private final List<String> articles;

    public SortKeyNormalizer(IndexOptions options) {
        this(options.locale(), options.caseSensitive(), options.ignoreArticles());
    }

    public SortKeyNormalizer(Locale locale, boolean caseSensitive, List<String> articles) {
        this.locale = locale == null ? Locale.ROOT : locale;
        this.caseSensitive = caseSensitive;
        this.articles = articles == null ? List.of() : articles.stream()
            .map(article -> article.trim().toLowerCase(this.locale))
            .filter(article -> !article.isEmpty())
            .toList();
    }

    /**
     * Key two markers must share to merge into one entry: case-folded unless case-sensitive,
     * first leading article removed.
     */
    public String mergeKey(String text) {
        String collapsed = AsciiTextNormalizer.collapseWhitespace(text);
        return stripArticle(caseSensitive ? collapsed : collapsed.toLowerCase(locale));
    }

    /**
     * Ordering key: diacritics stripped, lower-cased, leading article removed.
     */
    public String sortKey(String text) {
        String plain = AsciiTextNormalizer.stripDiacritics(AsciiTextNormalizer.collapseWhitespace(text));
        return stripArticle(plain.toLowerCase(locale));
    }

    /**
     * Section letter of a sort key: its first character upper-cased, {@code #} for non-letters.
     */
    public String groupLetter(String sortKey) {
        if (sortKey == null || sortKey.isEmpty()) {
            return IndexSection.SYMBOLS;
        }
        int first = sortKey.codePointAt(0);
        if (!Character.isLetter(first)) {
            return IndexSection.SYMBOLS;
        }
        return new String(Character.toChars(first)).toUpperCase(locale);
    }

    /**
     * Section letter for display text; stable when fed its own output.
     */
    public String groupKey(String text) {
        return groupLetter(sortKey(text));
    }

    private String stripArticle(String text) {
        String lowered = text.toLowerCase(locale);
        for (String article : articles) {
            String prefix = article + " ";
            if (lowered.startsWith(prefix) && text.length() > prefix.length()) {
                return text.substring(prefix.length()).trim();
            }
        }
        return text;
    }
}
