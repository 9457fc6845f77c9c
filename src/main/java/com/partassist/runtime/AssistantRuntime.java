package com.partassist.runtime;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.partassist.auth.AuthGate;
import com.partassist.catalog.CompatibilityCheckAdapter;
import com.partassist.catalog.OrderSupportAdapter;
import com.partassist.catalog.PartCatalog;
import com.partassist.catalog.ProductLookupAdapter;
import com.partassist.chat.ChatService;
import com.partassist.chat.TopicClassifier;
import com.partassist.corpus.CorpusLoadException;
import com.partassist.corpus.TrainingCorpus;
import com.partassist.corpus.TrainingCorpusLoader;
import com.partassist.dispatch.FallbackDispatcher;
import com.partassist.dispatch.GenericFallbackResponder;
import com.partassist.match.SimilarityMatcher;
import com.partassist.provider.ProviderAdapter;
import com.partassist.provider.ProviderAdapters;
import com.partassist.session.SessionReaper;
import com.partassist.session.SessionStore;

import okhttp3.OkHttpClient;

/**
 * Process-scoped wiring: the corpus is loaded once here, the session map lives here, and both
 * are handed to the components that need them.
 */
public final class AssistantRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AssistantRuntime.class);

    private final TrainingCorpus corpus;
    private final FallbackDispatcher dispatcher;
    private final SessionStore sessionStore;
    private final SessionReaper sessionReaper;
    private final ChatService chatService;
    private final AuthGate authGate;

    private AssistantRuntime(
            TrainingCorpus corpus,
            FallbackDispatcher dispatcher,
            SessionStore sessionStore,
            SessionReaper sessionReaper,
            ChatService chatService,
            AuthGate authGate) {
        this.corpus = corpus;
        this.dispatcher = dispatcher;
        this.sessionStore = sessionStore;
        this.sessionReaper = sessionReaper;
        this.chatService = chatService;
        this.authGate = authGate;
    }

    public static AssistantRuntime start(
            AppConfig config,
            Path corpusPath,
            OkHttpClient httpClient,
            Map<String, String> environment) throws CorpusLoadException {
        Clock clock = Clock.systemUTC();
        AuthGate authGate = AuthGate.fromConfig(config.getAuth(), environment, clock);
        TrainingCorpus corpus = new TrainingCorpusLoader().load(corpusPath);
        SimilarityMatcher matcher = new SimilarityMatcher(config.getMatcher().toSettings());
        List<ProviderAdapter> providers = new ArrayList<>();
        if (config.getRouting().isEnabled()) {
            providers.addAll(catalogAdapters(corpus));
        }
        providers.addAll(ProviderAdapters.fromConfig(config, httpClient, environment));
        FallbackDispatcher dispatcher = new FallbackDispatcher(
                providers,
                matcher,
                corpus,
                new GenericFallbackResponder(config.getFallback().getMessage()));

        AppConfig.SessionConfig sessions = config.getSessions();
        SessionStore sessionStore = new SessionStore(clock, Duration.ofMillis(Math.max(0L, sessions.getIdleTimeoutMs())));
        SessionReaper reaper = sessions.getIdleTimeoutMs() > 0 && sessions.getEvictionIntervalMs() > 0
                ? new SessionReaper(sessionStore, Duration.ofMillis(sessions.getEvictionIntervalMs()))
                : null;
        ChatService chatService = new ChatService(dispatcher, sessionStore, sessions.getContextTurns());

        log.info("Runtime ready corpusExamples={} providers={} matcherThreshold={} idleTimeoutMs={}",
                corpus.size(),
                providers.stream().map(ProviderAdapter::name).toList(),
                matcher.settings().threshold(),
                sessions.getIdleTimeoutMs());
        return new AssistantRuntime(corpus, dispatcher, sessionStore, reaper, chatService, authGate);
    }

    /**
     * Intent-routed adapters answered from the corpus's part records. They go ahead of the remote
     * providers and only take queries of their own intent.
     */
    static List<ProviderAdapter> catalogAdapters(TrainingCorpus corpus) {
        PartCatalog catalog = PartCatalog.fromCorpus(corpus);
        TopicClassifier classifier = new TopicClassifier();
        log.debug("Part catalog built parts={}", catalog.size());
        return List.of(
                new ProductLookupAdapter(catalog, classifier),
                new CompatibilityCheckAdapter(catalog, classifier),
                new OrderSupportAdapter(classifier));
    }

    public TrainingCorpus corpus() {
        return corpus;
    }

    public SessionStore sessionStore() {
        return sessionStore;
    }

    public ChatService chatService() {
        return chatService;
    }

    public AuthGate authGate() {
        return authGate;
    }

    @Override
    public void close() {
        if (sessionReaper != null) {
            sessionReaper.close();
        }
        dispatcher.close();
    }
}
