package com.partassist.provider;

import java.io.IOException;
import java.time.Duration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partassist.runtime.AppConfig;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * JSON-over-HTTP provider. Subclasses supply the request body and read the answer out of the
 * response tree; status codes, transport errors and unparseable bodies are mapped here.
 */
public abstract class HttpProviderAdapter implements ProviderAdapter {
    private static final MediaType JSON = MediaType.parse("application/json");

    protected final ObjectMapper mapper = new ObjectMapper();
    protected final PromptComposer promptComposer;
    protected final AppConfig.ProviderConfig config;
    private final OkHttpClient httpClient;
    private final String apiKey;
    private final Duration timeout;

    protected HttpProviderAdapter(
            AppConfig.ProviderConfig config,
            String apiKey,
            OkHttpClient httpClient,
            PromptComposer promptComposer) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("Provider " + config.getName() + " has no endpoint");
        }
        this.config = config;
        this.apiKey = apiKey;
        this.promptComposer = promptComposer;
        this.timeout = Duration.ofMillis(Math.max(1, config.getTimeoutMs()));
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeout)
                .build();
    }

    @Override
    public String name() {
        return config.getName();
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProviderResult answer(String query, ConversationContext context) {
        if (requiresCredential() && (apiKey == null || apiKey.isBlank())) {
            return ProviderResult.failure(FailureReason.AUTH_REJECTED,
                    "no credential in environment variable " + config.getApiKeyEnv());
        }
        try {
            String payload = mapper.writeValueAsString(requestBody(query, context));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(config.getEndpoint())
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }

            String body;
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful()) {
                    return ProviderResult.failure(HttpFailures.forStatus(response.code()), "HTTP " + response.code());
                }
                ResponseBody responseBody = response.body();
                body = responseBody == null ? "" : responseBody.string();
            }
            return parse(body);
        } catch (IOException e) {
            return ProviderResult.failure(HttpFailures.forException(e), describe(e));
        } catch (RuntimeException e) {
            return ProviderResult.failure(FailureReason.UNREACHABLE, describe(e));
        }
    }

    protected abstract Object requestBody(String query, ConversationContext context);

    protected abstract ProviderResult extractAnswer(JsonNode root);

    private boolean requiresCredential() {
        return config.getApiKeyEnv() != null && !config.getApiKeyEnv().isBlank();
    }

    private ProviderResult parse(String body) {
        if (body == null || body.isBlank()) {
            return ProviderResult.failure(FailureReason.MALFORMED_RESPONSE, "empty response body");
        }
        try {
            return extractAnswer(mapper.readTree(body));
        } catch (JsonProcessingException e) {
            return ProviderResult.failure(FailureReason.MALFORMED_RESPONSE, "response is not JSON");
        }
    }

    protected static ProviderResult malformed(String detail) {
        return ProviderResult.failure(FailureReason.MALFORMED_RESPONSE, detail);
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }
}
