package com.partassist.catalog;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.partassist.answer.AnswerPayload;
import com.partassist.answer.PartRecord;
import com.partassist.chat.TopicClassifier;
import com.partassist.provider.ConversationContext;
import com.partassist.provider.ProviderResult;

/**
 * Answers product questions from the part catalog: by part number when one is mentioned, otherwise
 * by part name or model number appearing in the question.
 */
public class ProductLookupAdapter extends IntentRoutedAdapter {
    public static final String NAME = "product-search";

    private static final Logger log = LoggerFactory.getLogger(ProductLookupAdapter.class);

    private final PartCatalog catalog;

    public ProductLookupAdapter(PartCatalog catalog, TopicClassifier classifier) {
        super(NAME, TopicClassifier.Intent.PRODUCT_INFO, classifier);
        this.catalog = catalog;
    }

    @Override
    public ProviderResult answer(String query, ConversationContext context) {
        Optional<String> partNumber = PartReferences.partNumber(query, context);
        if (partNumber.isPresent()) {
            Optional<PartRecord> part = catalog.findByPartNumber(partNumber.get());
            log.debug("Part lookup partNumber={} found={}", partNumber.get(), part.isPresent());
            if (part.isPresent()) {
                return ProviderResult.success(part.get());
            }
            return ProviderResult.success(AnswerPayload.text("I couldn't find part number " + partNumber.get()
                    + " in our current catalog. Please double-check the part number, or provide your "
                    + "appliance's model number so I can help you find the right part."));
        }
        List<PartRecord> hits = catalog.searchByKeywords(query);
        if (!hits.isEmpty()) {
            log.debug("Keyword search hits={}", hits.size());
            return ProviderResult.success(hits.get(0));
        }
        return ProviderResult.success(AnswerPayload.text("Please specify both the part number and the model number "
                + "of your appliance. You can usually find the model number on a sticker inside the appliance door "
                + "or on the back panel."));
    }
}
