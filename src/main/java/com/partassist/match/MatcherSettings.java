package com.partassist.match;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record MatcherSettings(
        double threshold,
        int minTokenLength,
        double boostFactor,
        Set<String> domainTerms) {

    public static final double DEFAULT_THRESHOLD = 0.20;
    public static final int DEFAULT_MIN_TOKEN_LENGTH = 3;
    public static final double DEFAULT_BOOST_FACTOR = 2.0;
    public static final List<String> DEFAULT_DOMAIN_TERMS = List.of(
            "refrigerator", "fridge", "dishwasher", "washing", "machine", "dryer",
            "cooling", "cleaning", "leaking", "filter", "light", "bulb", "water",
            "coil", "coils", "seal", "seals", "gasket", "drum", "compressor", "thermostat",
            "pump", "drain", "hose", "motor", "fan", "freezer", "ice", "door", "rack",
            "spray", "valve", "element", "belt", "heater");

    public MatcherSettings {
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be within [0,1]: " + threshold);
        }
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be >= 1: " + minTokenLength);
        }
        if (!(boostFactor >= 1.0) || Double.isInfinite(boostFactor)) {
            throw new IllegalArgumentException("boostFactor must be >= 1: " + boostFactor);
        }
        Set<String> normalized = new LinkedHashSet<>();
        if (domainTerms != null) {
            for (String term : domainTerms) {
                if (term != null && !term.isBlank()) {
                    normalized.add(term.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        domainTerms = Set.copyOf(normalized);
    }

    public static MatcherSettings defaults() {
        return new MatcherSettings(
                DEFAULT_THRESHOLD,
                DEFAULT_MIN_TOKEN_LENGTH,
                DEFAULT_BOOST_FACTOR,
                new LinkedHashSet<>(DEFAULT_DOMAIN_TERMS));
    }

    public boolean isDomainTerm(String token) {
        return domainTerms.contains(token);
    }
}
