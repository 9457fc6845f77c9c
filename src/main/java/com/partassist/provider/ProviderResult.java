package com.partassist.provider;

import com.partassist.answer.AnswerPayload;

public sealed interface ProviderResult permits ProviderResult.Success, ProviderResult.Failure {

    static ProviderResult success(AnswerPayload answer) {
        return new Success(answer);
    }

    static ProviderResult failure(FailureReason reason, String detail) {
        return new Failure(reason, detail);
    }

    record Success(AnswerPayload answer) implements ProviderResult {
    }

    record Failure(FailureReason reason, String detail) implements ProviderResult {
        public Failure {
            if (reason == null) {
                throw new IllegalArgumentException("Failure reason is required");
            }
            detail = detail == null ? "" : detail;
        }
    }
}
