package com.partassist.dispatch;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Keyword guidance used when neither a provider nor the training corpus produced an answer.
 * Rules are checked in order; the configured acknowledgement covers everything else.
 */
public class GenericFallbackResponder {
    private static final Pattern FIT = Pattern.compile("\\bfit\\b");
    private static final Pattern GREETING = Pattern.compile("\\b(?:help|hello|hi)\\b");

    private final String acknowledgement;
    private final List<Rule> rules;

    public GenericFallbackResponder(String acknowledgement) {
        if (acknowledgement == null || acknowledgement.isBlank()) {
            throw new IllegalArgumentException("Fallback acknowledgement must not be blank");
        }
        this.acknowledgement = acknowledgement;
        this.rules = defaultRules();
    }

    public String respond(String query) {
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (rule.applies().test(lower)) {
                return rule.response();
            }
        }
        return acknowledgement;
    }

    private static List<Rule> defaultRules() {
        return List.of(
                new Rule(q -> mentionsAny(q, "refrigerator", "fridge", "cooling", "cold", "temperature")
                        && mentionsAny(q, "not cooling", "warm"),
                        "For refrigerator cooling issues, check: 1) Temperature settings (should be 37-40°F), "
                                + "2) Clean condenser coils (usually on back or bottom), 3) Door seals for gaps, "
                                + "4) Frost buildup in freezer. If these don't help, you may need a new thermostat, "
                                + "evaporator fan, or compressor."),
                new Rule(q -> mentionsAny(q, "refrigerator", "fridge", "cooling", "cold", "temperature")
                        && mentionsAny(q, "leaking", "water"),
                        "Refrigerator water leaks usually come from: 1) Clogged defrost drain, 2) Loose water supply "
                                + "line, 3) Cracked drain pan, 4) Bad water filter. Check these components and replace "
                                + "as needed."),
                new Rule(q -> mentionsAny(q, "refrigerator", "fridge", "cooling", "cold", "temperature")
                        && mentionsAny(q, "light", "bulb"),
                        "Refrigerator lights use special appliance bulbs rated for cold temperatures. You'll need "
                                + "your refrigerator's model number to find the correct replacement bulb. Check inside "
                                + "the fridge or on the door frame for the model number."),
                new Rule(q -> mentionsAny(q, "refrigerator", "fridge", "cooling", "cold", "temperature"),
                        "I can help with refrigerator parts! Common issues include cooling problems, water leaks, "
                                + "faulty lights, and ice maker issues. Please describe your specific problem and "
                                + "provide your model number for accurate part recommendations."),
                new Rule(q -> mentionsAny(q, "filter"),
                        "To find the right water filter: 1) Locate your refrigerator's model number (inside the "
                                + "fridge or on door frame), 2) Remove the old filter and check for part numbers, "
                                + "3) Search for compatible filters using the model number. Most filters need "
                                + "replacement every 6 months."),
                new Rule(q -> mentionsAny(q, "dishwasher", "dishes", "washing")
                        && mentionsAny(q, "not cleaning", "dirty"),
                        "For dishwasher cleaning issues: 1) Clean the filter (bottom of dishwasher), 2) Check spray "
                                + "arms for clogs, 3) Use proper detergent amount, 4) Don't overcrowd dishes. You may "
                                + "need new spray arms or wash pump motor."),
                new Rule(q -> mentionsAny(q, "dishwasher", "dishes", "washing")
                        && mentionsAny(q, "not draining", "water"),
                        "Dishwasher drainage problems usually require: 1) Clean the drain filter, 2) Check garbage "
                                + "disposal connection, 3) Clear drain hose clogs, 4) Replace drain pump if needed."),
                new Rule(q -> mentionsAny(q, "dishwasher", "dishes", "washing"),
                        "I can help with dishwasher parts! Common issues include poor cleaning, drainage problems, "
                                + "door seal leaks, and control panel failures. What specific problem are you "
                                + "experiencing?"),
                new Rule(q -> mentionsAny(q, "install", "replace", "how to"),
                        "For installation help, I need to know: 1) What part you're installing, 2) Your appliance "
                                + "model number, 3) What tools you have available. Most parts come with instructions, "
                                + "but I can provide specific guidance once I know the details."),
                new Rule(q -> mentionsAny(q, "compatible", "work with") || FIT.matcher(q).find(),
                        "To check part compatibility, I need: 1) The exact part number, 2) Your appliance's complete "
                                + "model number. You can find the model number on a sticker inside your appliance or "
                                + "on the back/side panel."),
                new Rule(q -> GREETING.matcher(q).find(),
                        "Hello! I specialize in appliance parts for dishwashers and refrigerators. I can help you "
                                + "find parts, check compatibility, and provide installation guidance. What appliance "
                                + "are you working on today?"));
    }

    private static boolean mentionsAny(String lower, String... fragments) {
        for (String fragment : fragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private record Rule(Predicate<String> applies, String response) {
    }
}
