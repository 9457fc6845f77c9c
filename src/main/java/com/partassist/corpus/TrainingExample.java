package com.partassist.corpus;

import com.partassist.answer.AnswerPayload;

public record TrainingExample(String input, AnswerPayload output) {

    public TrainingExample {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Training example input must not be blank");
        }
        if (output == null) {
            throw new IllegalArgumentException("Training example output must not be null");
        }
    }
}
