package com.partassist.runtime;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.partassist.match.MatcherSettings;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private CorpusConfig corpus = new CorpusConfig();
    private MatcherConfig matcher = new MatcherConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private SessionConfig sessions = new SessionConfig();
    private AuthConfig auth = new AuthConfig();
    private FallbackConfig fallback = new FallbackConfig();
    private PromptConfig prompt = new PromptConfig();
    private RoutingConfig routing = new RoutingConfig();

    public CorpusConfig getCorpus() {
        return corpus;
    }

    public void setCorpus(CorpusConfig corpus) {
        this.corpus = corpus == null ? new CorpusConfig() : corpus;
    }

    public MatcherConfig getMatcher() {
        return matcher;
    }

    public void setMatcher(MatcherConfig matcher) {
        this.matcher = matcher == null ? new MatcherConfig() : matcher;
    }

    public List<ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderConfig> providers) {
        this.providers = providers == null ? new ArrayList<>() : providers;
    }

    public SessionConfig getSessions() {
        return sessions;
    }

    public void setSessions(SessionConfig sessions) {
        this.sessions = sessions == null ? new SessionConfig() : sessions;
    }

    public AuthConfig getAuth() {
        return auth;
    }

    public void setAuth(AuthConfig auth) {
        this.auth = auth == null ? new AuthConfig() : auth;
    }

    public FallbackConfig getFallback() {
        return fallback;
    }

    public void setFallback(FallbackConfig fallback) {
        this.fallback = fallback == null ? new FallbackConfig() : fallback;
    }

    public PromptConfig getPrompt() {
        return prompt;
    }

    public void setPrompt(PromptConfig prompt) {
        this.prompt = prompt == null ? new PromptConfig() : prompt;
    }

    public RoutingConfig getRouting() {
        return routing;
    }

    public void setRouting(RoutingConfig routing) {
        this.routing = routing == null ? new RoutingConfig() : routing;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CorpusConfig {
        private String path = "data/training_conversations.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MatcherConfig {
        private double threshold = MatcherSettings.DEFAULT_THRESHOLD;
        private int minTokenLength = MatcherSettings.DEFAULT_MIN_TOKEN_LENGTH;
        private double boostFactor = MatcherSettings.DEFAULT_BOOST_FACTOR;
        private List<String> domainTerms = new ArrayList<>(MatcherSettings.DEFAULT_DOMAIN_TERMS);

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getMinTokenLength() {
            return minTokenLength;
        }

        public void setMinTokenLength(int minTokenLength) {
            this.minTokenLength = minTokenLength;
        }

        public double getBoostFactor() {
            return boostFactor;
        }

        public void setBoostFactor(double boostFactor) {
            this.boostFactor = boostFactor;
        }

        public List<String> getDomainTerms() {
            return domainTerms;
        }

        public void setDomainTerms(List<String> domainTerms) {
            this.domainTerms = domainTerms == null ? new ArrayList<>(MatcherSettings.DEFAULT_DOMAIN_TERMS) : domainTerms;
        }

        public MatcherSettings toSettings() {
            return new MatcherSettings(threshold, minTokenLength, boostFactor, new LinkedHashSet<>(domainTerms));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String name;
        private String type = "chat-completions";
        private boolean enabled = true;
        private String endpoint;
        private String model;
        private String apiKeyEnv;
        private int timeoutMs = 8000;
        private double temperature = 0.2;
        private int maxTokens = 512;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionConfig {
        private long idleTimeoutMs = 1_800_000;
        private long evictionIntervalMs = 60_000;
        private int contextTurns = 10;

        public long getIdleTimeoutMs() {
            return idleTimeoutMs;
        }

        public void setIdleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
        }

        public long getEvictionIntervalMs() {
            return evictionIntervalMs;
        }

        public void setEvictionIntervalMs(long evictionIntervalMs) {
            this.evictionIntervalMs = evictionIntervalMs;
        }

        public int getContextTurns() {
            return contextTurns;
        }

        public void setContextTurns(int contextTurns) {
            this.contextTurns = contextTurns;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuthConfig {
        private String secretEnv = "PARTASSIST_JWT_SECRET";
        private String secret;
        private long tokenTtlSeconds = 86_400;

        public String getSecretEnv() {
            return secretEnv;
        }

        public void setSecretEnv(String secretEnv) {
            this.secretEnv = secretEnv;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public long getTokenTtlSeconds() {
            return tokenTtlSeconds;
        }

        public void setTokenTtlSeconds(long tokenTtlSeconds) {
            this.tokenTtlSeconds = tokenTtlSeconds;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FallbackConfig {
        private String message = "I'm here to help with appliance parts and repairs! I can assist with dishwashers "
                + "and refrigerators. Please tell me: 1) What type of appliance, 2) What problem you're "
                + "experiencing, 3) Your model number if you have it.";

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PromptConfig {
        private String systemPrompt = "You are a helpful assistant for an appliance parts store, specialised in "
                + "refrigerator and dishwasher parts. Answer the customer's question in a concise, friendly manner.";

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RoutingConfig {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
