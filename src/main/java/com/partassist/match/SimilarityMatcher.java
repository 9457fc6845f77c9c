package com.partassist.match;

import java.util.HashSet;
import java.util.Set;

import com.partassist.corpus.TrainingCorpus;
import com.partassist.corpus.TrainingExample;

/**
 * Weighted token-overlap matcher over the training corpus. Pure: no I/O, no shared mutable
 * state, identical output for identical input.
 */
public class SimilarityMatcher {
    private final MatcherSettings settings;
    private final TextNormalizer normalizer;

    public SimilarityMatcher() {
        this(MatcherSettings.defaults());
    }

    public SimilarityMatcher(MatcherSettings settings) {
        this.settings = settings;
        this.normalizer = new TextNormalizer(settings);
    }

    public MatcherSettings settings() {
        return settings;
    }

    /**
     * Jaccard overlap of the normalized token sets, multiplied by {@code boostFactor} once per
     * domain term shared by both sides, clamped to [0,1].
     */
    public double score(String queryText, String exampleText) {
        return clamp(boostedScore(queryText, exampleText));
    }

    /**
     * Entries are ranked on the unclamped boosted value and only the reported score is clamped,
     * so an identical token set always outranks a partial overlap.
     */
    public MatchResult match(String queryText, TrainingCorpus corpus) {
        TrainingExample best = null;
        double bestScore = 0.0;
        for (TrainingExample example : corpus.examples()) {
            double score = boostedScore(queryText, example.input());
            // strictly greater keeps the earliest entry on ties
            if (best == null || score > bestScore) {
                best = example;
                bestScore = score;
            }
        }
        double reported = clamp(bestScore);
        if (best == null || reported < settings.threshold()) {
            return MatchResult.noMatch(reported);
        }
        return new MatchResult(true, best, reported);
    }

    private double boostedScore(String queryText, String exampleText) {
        Set<String> query = normalizer.tokens(queryText);
        Set<String> example = normalizer.tokens(exampleText);
        if (query.isEmpty() && example.isEmpty()) {
            // nothing survived the length filter on either side ("Hi" vs "hi")
            return jaccard(normalizer.rawTokens(queryText), normalizer.rawTokens(exampleText));
        }
        if (query.isEmpty() || example.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(query);
        intersection.retainAll(example);
        if (intersection.isEmpty()) {
            return 0.0;
        }
        int union = query.size() + example.size() - intersection.size();
        double score = (double) intersection.size() / union;

        for (String token : intersection) {
            if (settings.isDomainTerm(token)) {
                score *= settings.boostFactor();
            }
        }
        return score;
    }

    private static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        int union = left.size() + right.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    private static double clamp(double value) {
        if (value < 0.0 || Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
