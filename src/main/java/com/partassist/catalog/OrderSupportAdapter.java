package com.partassist.catalog;

import java.util.List;
import java.util.Locale;

import com.partassist.answer.AnswerPayload;
import com.partassist.chat.TopicClassifier;
import com.partassist.provider.ConversationContext;
import com.partassist.provider.ProviderResult;

/**
 * Canned order, return and cancellation guidance.
 */
public class OrderSupportAdapter extends IntentRoutedAdapter {
    public static final String NAME = "order-support";

    private static final List<String> ORDER_WORDS = List.of("order", "delivery", "shipping", "tracking");

    public OrderSupportAdapter(TopicClassifier classifier) {
        super(NAME, TopicClassifier.Intent.ORDER_SUPPORT, classifier);
    }

    @Override
    public boolean accepts(String query, ConversationContext context) {
        if (!super.accepts(query, context)) {
            return false;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return ORDER_WORDS.stream().anyMatch(lower::contains);
    }

    @Override
    public ProviderResult answer(String query, ConversationContext context) {
        String lower = query.toLowerCase(Locale.ROOT);
        String message;
        if (lower.contains("status") || lower.contains("track")) {
            message = "You can track your order by logging into your account and opening the 'My Orders' section. "
                    + "If you need further assistance, please provide your order number.";
        } else if (lower.contains("return") || lower.contains("refund")) {
            message = "To start a return or refund, please visit our returns page or contact customer service "
                    + "at 1-800-123-4567.";
        } else if (lower.contains("cancel")) {
            message = "Orders may be cancelled before they are shipped. Please call our support line immediately "
                    + "to request a cancellation.";
        } else {
            message = "For questions about ordering, shipping or returns, please visit the support centre on our "
                    + "website or call us for assistance.";
        }
        return ProviderResult.success(AnswerPayload.text(message));
    }
}
