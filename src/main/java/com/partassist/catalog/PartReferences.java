package com.partassist.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.partassist.answer.TextAnswer;
import com.partassist.provider.ConversationContext;
import com.partassist.session.Turn;

/**
 * Pulls part and model numbers out of a question, falling back to earlier turns of the conversation.
 * Model numbers are only taken from what the customer wrote; assistant answers list compatible
 * models and would otherwise be mistaken for the customer's appliance.
 */
final class PartReferences {
    private static final Pattern PART_NUMBER = Pattern.compile("\\b(?:PS\\d+|WP[\\w\\d]+|W\\d{5,})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MODEL_NUMBER = Pattern.compile("\\b[A-Z]*\\d+[A-Z0-9]*\\b", Pattern.CASE_INSENSITIVE);

    private PartReferences() {
    }

    static Optional<String> partNumber(String query, ConversationContext context) {
        Optional<String> fromQuery = firstPartNumber(query);
        if (fromQuery.isPresent()) {
            return fromQuery;
        }
        List<Turn> turns = context.recentTurns();
        for (Turn.Role role : List.of(Turn.Role.USER, Turn.Role.ASSISTANT)) {
            for (int i = turns.size() - 1; i >= 0; i--) {
                Turn turn = turns.get(i);
                if (turn.role() == role) {
                    Optional<String> found = firstPartNumber(turn.content().contextText());
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * First alphanumeric token containing a digit that is not itself a part number.
     */
    static Optional<String> modelNumber(String query, ConversationContext context) {
        Optional<String> fromQuery = firstModelNumber(query);
        if (fromQuery.isPresent()) {
            return fromQuery;
        }
        List<Turn> turns = context.recentTurns();
        for (int i = turns.size() - 1; i >= 0; i--) {
            Turn turn = turns.get(i);
            if (turn.role() == Turn.Role.USER && turn.content() instanceof TextAnswer text) {
                Optional<String> found = firstModelNumber(text.contextText());
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    static Optional<String> firstPartNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = PART_NUMBER.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().toUpperCase(Locale.ROOT)) : Optional.empty();
    }

    private static Optional<String> firstModelNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = MODEL_NUMBER.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().toUpperCase(Locale.ROOT);
            if (!PART_NUMBER.matcher(candidate).matches()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
