package com.partassist.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.partassist.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ProviderAdapters {
    private static final Logger log = LoggerFactory.getLogger(ProviderAdapters.class);

    private ProviderAdapters() {
    }

    /**
     * Builds the enabled providers in configured priority order. Credentials are looked up in
     * {@code environment} by each provider's {@code apiKeyEnv}.
     */
    public static List<ProviderAdapter> fromConfig(
            AppConfig config,
            OkHttpClient httpClient,
            Map<String, String> environment) {
        PromptComposer promptComposer = new PromptComposer(config.getPrompt().getSystemPrompt());
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (AppConfig.ProviderConfig provider : config.getProviders()) {
            if (!provider.isEnabled()) {
                log.info("Provider {} disabled in configuration", provider.getName());
                continue;
            }
            String apiKey = provider.getApiKeyEnv() == null ? null : environment.get(provider.getApiKeyEnv());
            ProviderAdapter adapter = create(provider, apiKey, httpClient, promptComposer);
            log.info("Provider #{} name={} type={} model={} timeoutMs={} credential={}",
                    adapters.size() + 1,
                    adapter.name(),
                    provider.getType(),
                    provider.getModel(),
                    adapter.timeout().toMillis(),
                    apiKey == null || apiKey.isBlank() ? "absent" : "present");
            adapters.add(adapter);
        }
        return adapters;
    }

    static ProviderAdapter create(
            AppConfig.ProviderConfig provider,
            String apiKey,
            OkHttpClient httpClient,
            PromptComposer promptComposer) {
        String type = provider.getType() == null ? "" : provider.getType().toLowerCase(Locale.ROOT);
        switch (type) {
            case "chat-completions":
                return new ChatCompletionsProviderAdapter(provider, apiKey, httpClient, promptComposer);
            case "text-generation":
                return new TextGenerationProviderAdapter(provider, apiKey, httpClient, promptComposer);
            default:
                throw new IllegalArgumentException("Unknown provider type for " + provider.getName() + ": " + provider.getType());
        }
    }
}
