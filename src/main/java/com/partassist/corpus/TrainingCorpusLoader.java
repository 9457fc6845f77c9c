package com.partassist.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.partassist.answer.AnswerPayload;
import com.partassist.answer.PartRecord;

public class TrainingCorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(TrainingCorpusLoader.class);

    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    public TrainingCorpus load(Path source) throws CorpusLoadException {
        if (source == null || !Files.isRegularFile(source)) {
            throw new CorpusLoadException("Training corpus not found: " + source);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(source.toFile());
        } catch (IOException e) {
            throw new CorpusLoadException("Training corpus is not valid JSON: " + source, e);
        }
        if (root == null || !root.isArray()) {
            throw new CorpusLoadException("Training corpus must be a JSON array of {input, output} objects: " + source);
        }

        List<TrainingExample> examples = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            examples.add(toExample(root.get(i), i));
        }
        if (examples.isEmpty()) {
            log.warn("Training corpus {} is empty; last-resort answers will use the generic fallback only", source);
        }
        log.info("Loaded training corpus path={} examples={}", source, examples.size());
        return new TrainingCorpus(examples);
    }

    private TrainingExample toExample(JsonNode node, int index) throws CorpusLoadException {
        if (node == null || !node.isObject()) {
            throw new CorpusLoadException("Corpus element #" + index + " is not an object");
        }
        JsonNode input = node.get("input");
        if (input == null || !input.isTextual() || input.asText().isBlank()) {
            throw new CorpusLoadException("Corpus element #" + index + " has no non-empty \"input\"");
        }
        return new TrainingExample(input.asText(), toPayload(node.get("output"), index));
    }

    private AnswerPayload toPayload(JsonNode output, int index) throws CorpusLoadException {
        if (output == null || output.isNull()) {
            throw new CorpusLoadException("Corpus element #" + index + " has no \"output\"");
        }
        if (output.isTextual()) {
            if (output.asText().isBlank()) {
                throw new CorpusLoadException("Corpus element #" + index + " has a blank \"output\"");
            }
            return AnswerPayload.text(output.asText());
        }
        if (output.isObject()) {
            try {
                return objectMapper.treeToValue(output, PartRecord.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CorpusLoadException("Corpus element #" + index + " has an invalid part record output", e);
            }
        }
        throw new CorpusLoadException("Corpus element #" + index + " output must be text or a part record");
    }
}
