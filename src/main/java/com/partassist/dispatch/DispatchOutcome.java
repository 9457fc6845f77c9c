package com.partassist.dispatch;

import java.util.List;

import com.partassist.answer.AnswerPayload;

public record DispatchOutcome(
        AnswerPayload payload,
        AnswerSource source,
        String providerName,
        List<ProviderAttempt> failedAttempts,
        long elapsedMillis) {

    public DispatchOutcome {
        if (payload == null || source == null) {
            throw new IllegalArgumentException("Dispatch outcome needs a payload and a source");
        }
        failedAttempts = List.copyOf(failedAttempts);
    }

    /**
     * Provider name for provider answers, otherwise {@code training-data} or {@code generic-fallback}.
     */
    public String sourceTag() {
        return source == AnswerSource.PROVIDER ? providerName : source.tag();
    }
}
