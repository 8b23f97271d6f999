package com.relaybot.match;

import com.relaybot.model.MatchResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Case-insensitive substring matching of message text against a keyword list.
 *
 * <p>Text and keywords are normalized the same way: case-folded (upper then lower with
 * {@link Locale#ROOT}, so "STRASSE" and "straße" agree), Unicode whitespace runs including no-break
 * spaces collapsed to one space, then stripped. Matching is plain substring containment and is not
 * word-boundary aware, so "cat" also matches "category". The first keyword in configured order
 * that matches wins.
 */
public final class KeywordMatcher {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\p{Z}]+", Pattern.UNICODE_CHARACTER_CLASS);

    public MatchResult match(String text, List<String> keywords) {
        if (text == null || keywords == null || keywords.isEmpty()) {
            return MatchResult.noMatch();
        }
        String haystack = normalize(text);
        if (haystack.isEmpty()) {
            return MatchResult.noMatch();
        }
        for (String keyword : keywords) {
            String needle = normalize(keyword);
            if (!needle.isEmpty() && haystack.contains(needle)) {
                return MatchResult.matched(keyword);
            }
        }
        return MatchResult.noMatch();
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String folded = raw.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
        return WHITESPACE_RUN.matcher(folded).replaceAll(" ").strip();
    }

    /**
     * Strips keywords, drops blanks and drops duplicates under normalization. The first spelling of a
     * duplicate is kept.
     */
    public static List<String> normalizeKeywords(Iterable<String> keywords) {
        List<String> out = new ArrayList<>();
        if (keywords == null) {
            return out;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword == null) {
                continue;
            }
            String cleaned = keyword.strip();
            if (cleaned.isEmpty()) {
                continue;
            }
            if (seen.add(normalize(cleaned))) {
                out.add(cleaned);
            }
        }
        return out;
    }
}
