package com.partassist.match;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public final class TextNormalizer {
    private final MatcherSettings settings;

    public TextNormalizer(MatcherSettings settings) {
        this.settings = settings;
    }

    public Set<String> rawTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder cleaned = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == '\'' || c == '’') {
                continue;
            }
            cleaned.append(Character.isLetterOrDigit(c) ? c : ' ');
        }
        for (String part : cleaned.toString().trim().split("\\s+")) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    public Set<String> tokens(String text) {
        Set<String> filtered = new LinkedHashSet<>();
        for (String token : rawTokens(text)) {
            if (token.length() >= settings.minTokenLength() || settings.isDomainTerm(token)) {
                filtered.add(token);
            }
        }
        return filtered;
    }
}
