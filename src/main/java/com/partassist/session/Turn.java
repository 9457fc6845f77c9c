package com.partassist.session;

import java.util.Locale;

import com.partassist.answer.AnswerPayload;

public record Turn(Role role, AnswerPayload content) {

    public enum Role {
        USER,
        ASSISTANT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Turn {
        if (role == null || content == null) {
            throw new IllegalArgumentException("Turn role and content are required");
        }
    }

    public static Turn user(String message) {
        return new Turn(Role.USER, AnswerPayload.text(message));
    }

    public static Turn assistant(AnswerPayload answer) {
        return new Turn(Role.ASSISTANT, answer);
    }
}
