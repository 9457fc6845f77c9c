package com.partassist.provider;

import java.time.Duration;

/**
 * One answer service. Implementations must not throw: transport, status and payload problems
 * come back as {@link ProviderResult.Failure}.
 */
public interface ProviderAdapter {
    String name();

    Duration timeout();

    /**
     * Whether this adapter handles the query at all. Skipped adapters are not attempts and are
     * not recorded as failures. General-purpose providers take everything.
     */
    default boolean accepts(String query, ConversationContext context) {
        return true;
    }

    ProviderResult answer(String query, ConversationContext context);
}
