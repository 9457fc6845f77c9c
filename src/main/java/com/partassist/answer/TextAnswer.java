package com.partassist.answer;

public record TextAnswer(String text) implements AnswerPayload {

    public TextAnswer {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Answer text must not be blank");
        }
    }

    @Override
    public String contextText() {
        return text;
    }
}
