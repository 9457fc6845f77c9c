package com.partassist.chat;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword intent and appliance detection used to keep a session's last topic current.
 */
public class TopicClassifier {
    private static final Pattern PART_NUMBER = Pattern.compile("\\b(?:PS\\d+|WP[\\w\\d]+|W\\d{5,})\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> INSTALLATION = List.of("install", "installation", "fix", "repair", "replace",
            "broken", "not working", "issue", "problem", "troubleshoot", "how to");
    private static final List<String> COMPATIBILITY = List.of("compatible", "fit", "model", "work with");
    private static final List<String> ORDER_SUPPORT = List.of("order", "return", "refund", "track", "shipping", "delivery");
    private static final List<String> PRODUCT_INFO = List.of("part", "parts", "find", "search", "looking for");

    public enum Intent {
        INSTALLATION,
        COMPATIBILITY,
        ORDER_SUPPORT,
        PRODUCT_INFO,
        GENERAL
    }

    public Intent intent(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (containsAny(lower, INSTALLATION)) {
            return Intent.INSTALLATION;
        }
        if (containsAny(lower, COMPATIBILITY)) {
            return Intent.COMPATIBILITY;
        }
        if (containsAny(lower, ORDER_SUPPORT)) {
            return Intent.ORDER_SUPPORT;
        }
        if ((message != null && PART_NUMBER.matcher(message).find()) || containsAny(lower, PRODUCT_INFO)) {
            return Intent.PRODUCT_INFO;
        }
        return Intent.GENERAL;
    }

    public Optional<String> appliance(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (containsAny(lower, List.of("refrigerator", "fridge", "freezer", "ice maker"))) {
            return Optional.of("refrigerator");
        }
        if (containsAny(lower, List.of("dishwasher", "dishes"))) {
            return Optional.of("dishwasher");
        }
        return Optional.empty();
    }

    /**
     * The appliance named in the message; otherwise the previous topic; otherwise the message's intent.
     */
    public String nextTopic(String message, String previousTopic) {
        Optional<String> appliance = appliance(message);
        if (appliance.isPresent()) {
            return appliance.get();
        }
        if (previousTopic != null) {
            return previousTopic;
        }
        Intent intent = intent(message);
        return intent == Intent.GENERAL ? null : intent.name().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        return keywords.stream().anyMatch(lower::contains);
    }
}
