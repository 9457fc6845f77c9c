package com.partassist.provider;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.partassist.answer.AnswerPayload;
import com.partassist.runtime.AppConfig;

import okhttp3.OkHttpClient;

/**
 * OpenAI-compatible {@code chat/completions} endpoint (OpenAI, DeepSeek, local gateways).
 */
public class ChatCompletionsProviderAdapter extends HttpProviderAdapter {

    public ChatCompletionsProviderAdapter(
            AppConfig.ProviderConfig config,
            String apiKey,
            OkHttpClient httpClient,
            PromptComposer promptComposer) {
        super(config, apiKey, httpClient, promptComposer);
    }

    @Override
    protected Object requestBody(String query, ConversationContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.getModel());
        payload.put("messages", promptComposer.messages(query, context));
        payload.put("temperature", config.getTemperature());
        if (config.getMaxTokens() > 0) {
            payload.put("max_tokens", config.getMaxTokens());
        }
        return payload;
    }

    @Override
    protected ProviderResult extractAnswer(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return malformed("missing choices[0].message.content");
        }
        String answer = content.asText().strip();
        if (answer.isEmpty()) {
            return malformed("blank completion");
        }
        if (answer.toLowerCase(Locale.ROOT).startsWith("error")) {
            return malformed("provider returned an error message as content");
        }
        return ProviderResult.success(AnswerPayload.text(answer));
    }
}
