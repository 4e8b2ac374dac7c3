package com.williamcallahan.crossref.service.index;

import com.williamcallahan.crossref.domain.index.IndexTerm;
import com.williamcallahan.crossref.support.AsciiTextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of an index marker into a typed {@link IndexTerm}.
 *
 * <p>Syntax: {@code main[:sub[:sub...]]}, optionally followed by {@code see X} or
 * {@code see also X} clauses separated by {@code ;} or {@code ,}. {@code *term*} marks
 * emphasis; {@code **term**} also marks the occurrence as primary.</p>
 */
public final class IndexTermParser {

    private static final Pattern SEE_CLAUSE = Pattern.compile("\\bsee\\s+(also\\s+)?([^;,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s;,.:]+$");
    private static final String STRONG_MARK = "**";
    private static final String EMPHASIS_MARK = "*";

    private IndexTermParser() {}

    /**
     * Parses marker text.
     *
     * @param rawText marker text as authored
     * @return parsed term, empty when no main term remains
     */
    public static Optional<IndexTerm> parse(String rawText) {
        if (rawText == null) {
            return Optional.empty();
        }
        String text = AsciiTextNormalizer.collapseWhitespace(rawText);
        List<String> seeRefs = new ArrayList<>();
        List<String> seeAlsoRefs = new ArrayList<>();

        Matcher matcher = SEE_CLAUSE.matcher(text);
        StringBuilder remainder = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            String target = cleanReference(matcher.group(2));
            if (!target.isEmpty()) {
                (matcher.group(1) != null ? seeAlsoRefs : seeRefs).add(target);
            }
            remainder.append(text, last, matcher.start());
            last = matcher.end();
        }
        remainder.append(text.substring(last));
        String termText = TRAILING_SEPARATORS.matcher(remainder.toString().trim()).replaceAll("");

        boolean emphasis = false;
        boolean primary = false;
        List<String> parts = new ArrayList<>();
        for (String part : termText.split(":")) {
            String trimmed = part.trim();
            if (isWrapped(trimmed, STRONG_MARK)) {
                emphasis = true;
                primary = true;
                trimmed = unwrap(trimmed, STRONG_MARK);
            } else if (isWrapped(trimmed, EMPHASIS_MARK)) {
                emphasis = true;
                trimmed = unwrap(trimmed, EMPHASIS_MARK);
            }
            parts.add(trimmed);
        }
        if (parts.isEmpty() || parts.get(0).isEmpty()) {
            return Optional.empty();
        }
        String main = parts.get(0);
        List<String> subTerms = parts.subList(1, parts.size()).stream()
            .filter(sub -> !sub.isEmpty())
            .toList();
        return Optional.of(new IndexTerm(rawText, main, subTerms, seeRefs, seeAlsoRefs, emphasis, primary));
    }

    private static boolean isWrapped(String text, String mark) {
        return text.length() > mark.length() * 2 && text.startsWith(mark) && text.endsWith(mark);
    }

    private static String unwrap(String text, String mark) {
        return text.substring(mark.length(), text.length() - mark.length()).trim();
    }

    private static String cleanReference(String reference) {
        return TRAILING_SEPARATORS.matcher(reference.trim()).replaceAll("");
    }
}
