package com.partassist.match;

import java.util.Optional;

import com.partassist.corpus.TrainingExample;

public record MatchResult(boolean matched, TrainingExample example, double score) {

    public static MatchResult noMatch(double bestScore) {
        return new MatchResult(false, null, bestScore);
    }

    public Optional<TrainingExample> bestExample() {
        return Optional.ofNullable(example);
    }
}
