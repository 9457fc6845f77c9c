package com.partassist.catalog;

import java.time.Duration;

import com.partassist.chat.TopicClassifier;
import com.partassist.provider.ConversationContext;
import com.partassist.provider.ProviderAdapter;

/**
 * Local adapter that only takes queries of one intent. Answers are computed in memory, so the
 * timeout is short.
 */
public abstract class IntentRoutedAdapter implements ProviderAdapter {
    static final Duration LOCAL_TIMEOUT = Duration.ofSeconds(2);

    private final String name;
    private final TopicClassifier.Intent intent;
    private final TopicClassifier classifier;

    protected IntentRoutedAdapter(String name, TopicClassifier.Intent intent, TopicClassifier classifier) {
        this.name = name;
        this.intent = intent;
        this.classifier = classifier;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Duration timeout() {
        return LOCAL_TIMEOUT;
    }

    @Override
    public boolean accepts(String query, ConversationContext context) {
        return classifier.intent(query) == intent;
    }
}
