package com.partassist.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.partassist.answer.AnswerPayload;
import com.partassist.runtime.AppConfig;

import okhttp3.OkHttpClient;

/**
 * Hosted text-generation inference endpoint (Hugging Face style {@code generated_text} replies).
 * Small conversational models drift, so short or degenerate generations count as malformed.
 */
public class TextGenerationProviderAdapter extends HttpProviderAdapter {
    static final int MIN_ANSWER_LENGTH = 10;
    private static final List<String> DEGENERATE_PHRASES = List.of("no idea", "guess", "cooler cooler");

    public TextGenerationProviderAdapter(
            AppConfig.ProviderConfig config,
            String apiKey,
            OkHttpClient httpClient,
            PromptComposer promptComposer) {
        super(config, apiKey, httpClient, promptComposer);
    }

    @Override
    protected Object requestBody(String query, ConversationContext context) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("max_new_tokens", config.getMaxTokens());
        parameters.put("temperature", config.getTemperature());
        parameters.put("return_full_text", false);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputs", promptComposer.plainPrompt(query, context));
        payload.put("parameters", parameters);
        return payload;
    }

    @Override
    protected ProviderResult extractAnswer(JsonNode root) {
        JsonNode generated = root.isArray()
                ? root.path(0).path("generated_text")
                : root.path("generated_text");
        if (!generated.isTextual()) {
            return malformed("missing generated_text");
        }
        String answer = generated.asText().strip();
        if (answer.length() < MIN_ANSWER_LENGTH) {
            return malformed("generation too short");
        }
        if (isDegenerate(answer)) {
            return malformed("degenerate generation");
        }
        return ProviderResult.success(AnswerPayload.text(answer));
    }

    static boolean isDegenerate(String answer) {
        String lower = answer.toLowerCase(Locale.ROOT);
        if (DEGENERATE_PHRASES.stream().anyMatch(lower::contains)) {
            return true;
        }
        String[] words = lower.split("\\s+");
        int run = 1;
        for (int i = 1; i < words.length; i++) {
            run = words[i].equals(words[i - 1]) ? run + 1 : 1;
            if (run >= 3) {
                return true;
            }
        }
        return false;
    }
}
