package com.partassist.corpus;

import java.util.List;

/**
 * Read-only question/answer pairs in document order. Built once at startup and shared by
 * every turn without locking.
 */
public final class TrainingCorpus {
    private static final TrainingCorpus EMPTY = new TrainingCorpus(List.of());

    private final List<TrainingExample> examples;

    public TrainingCorpus(List<TrainingExample> examples) {
        this.examples = List.copyOf(examples);
    }

    public static TrainingCorpus empty() {
        return EMPTY;
    }

    public List<TrainingExample> examples() {
        return examples;
    }

    public int size() {
        return examples.size();
    }

    public boolean isEmpty() {
        return examples.isEmpty();
    }
}
