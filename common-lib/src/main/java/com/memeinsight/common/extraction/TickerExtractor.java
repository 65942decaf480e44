package com.memeinsight.common.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pulls candidate ticker symbols out of free text.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>Tokens are maximal runs of ASCII letters/digits; anything else is a boundary.
 *       A token only matches a symbol exactly, never as a substring.</li>
 *   <li>Bare tokens match case-sensitively against the known-symbol set and are
 *       rejected when blacklisted or when the text carries one of the symbol's
 *       context words.</li>
 *   <li>A token directly preceded by {@code $} is a cashtag: accepted (upper-cased)
 *       whenever it is 1–5 alphanumerics containing at least one letter, known or
 *       not, blacklisted or not.</li>
 * </ul>
 *
 * <p>Result order is first-appearance order; duplicates collapse. No side effects.
 */
public final class TickerExtractor {

    private static final int MAX_SYMBOL_LENGTH = 5;
    private static final char CASHTAG = '$';

    private final Set<String> knownSymbols;
    private final Set<String> blacklist;
    private final Map<String, List<Pattern>> contextPatterns;

    public TickerExtractor(Set<String> knownSymbols, Set<String> blacklist,
                           Map<String, List<String>> contextExclusions) {
        this.knownSymbols = Set.copyOf(knownSymbols);
        this.blacklist = Set.copyOf(blacklist);
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        contextExclusions.forEach((symbol, words) -> compiled.put(symbol, words.stream()
            .map(w -> Pattern.compile("\\b" + Pattern.quote(w.toLowerCase(Locale.ROOT)) + "\\b"))
            .toList()));
        this.contextPatterns = Collections.unmodifiableMap(compiled);
    }

    public static TickerExtractor from(SymbolCatalog catalog) {
        return new TickerExtractor(catalog.knownSymbols(), catalog.blacklist(), catalog.contextExclusions());
    }

    /** Convenience for callers that carry no context-exclusion table. */
    public static Set<String> extract(String text, Set<String> knownSymbols, Set<String> blacklist) {
        return new TickerExtractor(knownSymbols, blacklist, Map.of()).extract(text);
    }

    public Set<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        Set<String> found = new LinkedHashSet<>();
        String lower = null;
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            boolean cashtag = false;
            int start = i;
            if (c == CASHTAG && i + 1 < n && isAsciiAlnum(text.charAt(i + 1))
                    && (i == 0 || !isAsciiAlnum(text.charAt(i - 1)))) {
                cashtag = true;
                start = i + 1;
            } else if (!isAsciiAlnum(c)) {
                i++;
                continue;
            }
            int end = start;
            while (end < n && isAsciiAlnum(text.charAt(end))) {
                end++;
            }
            String token = text.substring(start, end);
            i = end;

            if (token.length() > MAX_SYMBOL_LENGTH) {
                continue;
            }
            if (cashtag) {
                if (containsLetter(token)) {
                    found.add(token.toUpperCase(Locale.ROOT));
                }
                continue;
            }
            if (!knownSymbols.contains(token) || blacklist.contains(token)) {
                continue;
            }
            List<Pattern> context = contextPatterns.get(token);
            if (context != null) {
                if (lower == null) lower = text.toLowerCase(Locale.ROOT);
                final String haystack = lower;
                if (context.stream().anyMatch(p -> p.matcher(haystack).find())) {
                    continue;
                }
            }
            found.add(token);
        }
        return Collections.unmodifiableSet(found);
    }

    private static boolean isAsciiAlnum(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    private static boolean containsLetter(String token) {
        for (int k = 0; k < token.length(); k++) {
            if (Character.isLetter(token.charAt(k))) return true;
        }
        return false;
    }
}
