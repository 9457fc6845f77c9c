package com.partassist.answer;

/**
 * Opaque answer produced by a provider, the training corpus or the generic fallback.
 * Either plain text or a structured part record; layout is left to the presentation layer.
 */
public sealed interface AnswerPayload permits TextAnswer, PartRecord {

    /**
     * Plain-text rendering used when the payload is replayed to a provider as conversation context.
     */
    String contextText();

    static AnswerPayload text(String text) {
        return new TextAnswer(text);
    }
}
