package com.partassist.provider;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partassist.answer.AnswerPayload;
import com.partassist.answer.TextAnswer;
import com.partassist.runtime.AppConfig;
import com.partassist.session.Turn;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class ChatCompletionsProviderAdapterTest {

    private final OkHttpClient httpClient = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();
    private final PromptComposer promptComposer = new PromptComposer("You are a parts assistant.");
    private MockWebServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReturnCompletionAndSendHistoryWithBearerCredential() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  Try resetting the breaker \"}}]}"));
        ChatCompletionsProviderAdapter adapter = adapter(config(2000), "secret-key");
        ConversationContext context = new ConversationContext(
                List.of(Turn.user("Hi"), Turn.assistant(AnswerPayload.text("Hello! Which appliance?"))),
                "refrigerator");

        ProviderResult result = adapter.answer("My fridge stopped", context);

        ProviderResult.Success success = assertInstanceOf(ProviderResult.Success.class, result);
        assertEquals("Try resetting the breaker", assertInstanceOf(TextAnswer.class, success.answer()).text());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("Bearer secret-key", request.getHeader("Authorization"));
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("test-model", body.path("model").asText());
        JsonNode messages = body.path("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).path("role").asText());
        assertEquals("user", messages.get(1).path("role").asText());
        assertEquals("Hi", messages.get(1).path("content").asText());
        assertEquals("assistant", messages.get(2).path("role").asText());
        assertEquals("My fridge stopped", messages.get(3).path("content").asText());
        assertEquals(0.2, body.path("temperature").asDouble(), 1e-9);
    }

    @Test
    void shouldMapStatusCodesToFailureReasons() {
        assertFailure(401, FailureReason.AUTH_REJECTED);
        assertFailure(403, FailureReason.AUTH_REJECTED);
        assertFailure(429, FailureReason.RATE_LIMITED);
        assertFailure(504, FailureReason.TIMEOUT);
        assertFailure(500, FailureReason.UNREACHABLE);
        assertFailure(404, FailureReason.UNREACHABLE);
    }

    @Test
    void shouldTreatUnparseableOrEmptyContentAsMalformed() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>oops</html>"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"choices\":[]}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"choices\":[{\"message\":{\"content\":\"   \"}}]}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"choices\":[{\"message\":{\"content\":\"Error: model overloaded\"}}]}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(""));
        ChatCompletionsProviderAdapter adapter = adapter(config(2000), "key");

        for (int i = 0; i < 5; i++) {
            ProviderResult result = adapter.answer("question", ConversationContext.empty());
            assertEquals(FailureReason.MALFORMED_RESPONSE, assertInstanceOf(ProviderResult.Failure.class, result).reason());
        }
    }

    @Test
    void shouldFailWithoutNetworkCallWhenCredentialIsMissing() {
        ChatCompletionsProviderAdapter adapter = adapter(config(2000), null);

        ProviderResult result = adapter.answer("question", ConversationContext.empty());

        assertEquals(FailureReason.AUTH_REJECTED, assertInstanceOf(ProviderResult.Failure.class, result).reason());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldReportTimeoutWhenServerIsSlowerThanCallTimeout() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeadersDelay(2, TimeUnit.SECONDS)
                .setBody("{\"choices\":[{\"message\":{\"content\":\"late\"}}]}"));
        ChatCompletionsProviderAdapter adapter = adapter(config(200), "key");

        ProviderResult result = adapter.answer("question", ConversationContext.empty());

        assertEquals(FailureReason.TIMEOUT, assertInstanceOf(ProviderResult.Failure.class, result).reason());
    }

    @Test
    void shouldReportUnreachableWhenNothingListens() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        AppConfig.ProviderConfig config = config(2000);
        config.setEndpoint(stopped.url("/v1/chat/completions").toString());
        stopped.shutdown();

        ProviderResult result = adapter(config, "key").answer("question", ConversationContext.empty());

        assertEquals(FailureReason.UNREACHABLE, assertInstanceOf(ProviderResult.Failure.class, result).reason());
    }

    @Test
    void shouldReportUnreachableForInvalidEndpoint() {
        AppConfig.ProviderConfig config = config(2000);
        config.setEndpoint("not a url");

        ProviderResult result = adapter(config, "key").answer("question", ConversationContext.empty());

        assertEquals(FailureReason.UNREACHABLE, assertInstanceOf(ProviderResult.Failure.class, result).reason());
    }

    private void assertFailure(int status, FailureReason expected) {
        server.enqueue(new MockResponse().setResponseCode(status).setBody("{\"error\":\"nope\"}"));
        ProviderResult result = adapter(config(2000), "key").answer("question", ConversationContext.empty());
        ProviderResult.Failure failure = assertInstanceOf(ProviderResult.Failure.class, result);
        assertEquals(expected, failure.reason(), "status " + status);
        assertEquals("HTTP " + status, failure.detail());
    }

    private ChatCompletionsProviderAdapter adapter(AppConfig.ProviderConfig config, String apiKey) {
        return new ChatCompletionsProviderAdapter(config, apiKey, httpClient, promptComposer);
    }

    private AppConfig.ProviderConfig config(int timeoutMs) {
        AppConfig.ProviderConfig config = new AppConfig.ProviderConfig();
        config.setName("primary");
        config.setEndpoint(server.url("/v1/chat/completions").toString());
        config.setModel("test-model");
        config.setApiKeyEnv("TEST_API_KEY");
        config.setTimeoutMs(timeoutMs);
        return config;
    }
}
