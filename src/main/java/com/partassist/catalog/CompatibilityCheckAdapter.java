package com.partassist.catalog;

import java.util.Locale;
import java.util.Optional;

import com.partassist.answer.AnswerPayload;
import com.partassist.answer.PartRecord;
import com.partassist.chat.TopicClassifier;
import com.partassist.provider.ConversationContext;
import com.partassist.provider.ProviderResult;

/**
 * Checks a part number against a model number using the catalog's compatibility lists. Asks for
 * whichever of the two is missing.
 */
public class CompatibilityCheckAdapter extends IntentRoutedAdapter {
    public static final String NAME = "compatibility";

    private final PartCatalog catalog;

    public CompatibilityCheckAdapter(PartCatalog catalog, TopicClassifier classifier) {
        super(NAME, TopicClassifier.Intent.COMPATIBILITY, classifier);
        this.catalog = catalog;
    }

    @Override
    public ProviderResult answer(String query, ConversationContext context) {
        Optional<String> partNumber = PartReferences.partNumber(query, context);
        Optional<String> model = PartReferences.modelNumber(query, context);
        if (partNumber.isEmpty() && model.isEmpty()) {
            return text("Please specify both the part number and the model number.");
        }
        if (partNumber.isEmpty()) {
            return text("I can see model " + model.get() + ", but I need the part number too. "
                    + "What part are you asking about?");
        }
        if (model.isEmpty()) {
            return text("I can see part number " + partNumber.get()
                    + ", but I need your appliance model number to check compatibility.");
        }

        Optional<PartRecord> part = catalog.findByPartNumber(partNumber.get());
        if (part.isEmpty()) {
            return text("I couldn't find part " + partNumber.get() + " in our catalogue.");
        }
        boolean compatible = part.get().modelCompatibility().stream()
                .anyMatch(listed -> listed.toUpperCase(Locale.ROOT).equals(model.get()));
        return compatible
                ? text("Yes, part " + partNumber.get() + " is compatible with model " + model.get() + ".")
                : text("No, part " + partNumber.get() + " is not listed as compatible with model " + model.get() + ".");
    }

    private static ProviderResult text(String message) {
        return ProviderResult.success(AnswerPayload.text(message));
    }
}
