package com.partassist.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.partassist.answer.PartRecord;
import com.partassist.corpus.TrainingCorpus;
import com.partassist.corpus.TrainingExample;

/**
 * Part records indexed by part number. Built from the structured answers in the training corpus;
 * when two entries share a part number the earlier one is kept.
 */
public final class PartCatalog {
    private final Map<String, PartRecord> byPartNumber;

    public PartCatalog(List<PartRecord> parts) {
        Map<String, PartRecord> index = new LinkedHashMap<>();
        for (PartRecord part : parts) {
            if (part.partNumber() != null && !part.partNumber().isBlank()) {
                index.putIfAbsent(key(part.partNumber()), part);
            }
        }
        this.byPartNumber = index;
    }

    public static PartCatalog fromCorpus(TrainingCorpus corpus) {
        List<PartRecord> parts = new ArrayList<>();
        for (TrainingExample example : corpus.examples()) {
            if (example.output() instanceof PartRecord part) {
                parts.add(part);
            }
        }
        return new PartCatalog(parts);
    }

    public Optional<PartRecord> findByPartNumber(String partNumber) {
        if (partNumber == null || partNumber.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byPartNumber.get(key(partNumber)));
    }

    /**
     * Parts whose name, or one of whose compatible model numbers, appears in the query.
     */
    public List<PartRecord> searchByKeywords(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        List<PartRecord> hits = new ArrayList<>();
        for (PartRecord part : byPartNumber.values()) {
            boolean nameHit = lower.contains(part.name().toLowerCase(Locale.ROOT));
            boolean modelHit = part.modelCompatibility().stream()
                    .anyMatch(model -> lower.contains(model.toLowerCase(Locale.ROOT)));
            if (nameHit || modelHit) {
                hits.add(part);
            }
        }
        return hits;
    }

    public int size() {
        return byPartNumber.size();
    }

    public boolean isEmpty() {
        return byPartNumber.isEmpty();
    }

    private static String key(String partNumber) {
        return partNumber.trim().toUpperCase(Locale.ROOT);
    }
}
