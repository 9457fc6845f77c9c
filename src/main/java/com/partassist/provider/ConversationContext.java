package com.partassist.provider;

import java.util.List;
import java.util.Optional;

import com.partassist.session.Turn;

/**
 * Recent turns and topic handed to a provider on each call. Providers keep no state of their own.
 */
public record ConversationContext(List<Turn> recentTurns, String lastTopic) {

    public ConversationContext {
        recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
    }

    public static ConversationContext empty() {
        return new ConversationContext(List.of(), null);
    }

    public Optional<String> topic() {
        return Optional.ofNullable(lastTopic);
    }
}
