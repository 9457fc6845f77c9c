package com.partassist.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.partassist.answer.AnswerPayload;
import com.partassist.corpus.TrainingCorpus;
import com.partassist.match.MatchResult;
import com.partassist.match.SimilarityMatcher;
import com.partassist.provider.ConversationContext;
import com.partassist.provider.FailureReason;
import com.partassist.provider.ProviderAdapter;
import com.partassist.provider.ProviderResult;

/**
 * Tries providers one at a time in priority order and stops at the first success. When all of
 * them fail the training corpus is matched, and when that finds nothing the generic responder
 * answers. A dispatch therefore always yields a payload.
 */
public class FallbackDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FallbackDispatcher.class);

    private final List<ProviderAdapter> providers;
    private final SimilarityMatcher matcher;
    private final TrainingCorpus corpus;
    private final GenericFallbackResponder genericResponder;
    private final ExecutorService executor;

    public FallbackDispatcher(
            List<ProviderAdapter> providers,
            SimilarityMatcher matcher,
            TrainingCorpus corpus,
            GenericFallbackResponder genericResponder) {
        this.providers = List.copyOf(providers);
        this.matcher = matcher;
        this.corpus = corpus;
        this.genericResponder = genericResponder;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<ProviderAdapter> providers() {
        return providers;
    }

    public DispatchOutcome dispatch(String query, ConversationContext context) {
        long dispatchStart = System.nanoTime();
        List<ProviderAttempt> failures = new ArrayList<>();
        for (ProviderAdapter provider : providers) {
            if (!provider.accepts(query, context)) {
                log.debug("Provider {} does not handle this query", provider.name());
                continue;
            }
            long start = System.nanoTime();
            ProviderResult result = invokeBounded(provider, query, context);
            long elapsedMs = millisSince(start);

            if (result instanceof ProviderResult.Success success) {
                DispatchOutcome outcome = new DispatchOutcome(success.answer(), AnswerSource.PROVIDER, provider.name(),
                        failures, millisSince(dispatchStart));
                logOutcome(outcome);
                return outcome;
            }
            ProviderResult.Failure failure = (ProviderResult.Failure) result;
            failures.add(new ProviderAttempt(provider.name(), failure.reason(), failure.detail(), elapsedMs));
            log.warn("dispatch.provider_failed provider={} reason={} elapsedMs={} detail={}",
                    provider.name(), failure.reason(), elapsedMs, failure.detail());
        }

        DispatchOutcome outcome = lastResort(query, failures, dispatchStart);
        logOutcome(outcome);
        return outcome;
    }

    private ProviderResult invokeBounded(ProviderAdapter provider, String query, ConversationContext context) {
        long timeoutMs = Math.max(1L, provider.timeout().toMillis());
        Future<ProviderResult> future = executor.submit(() -> provider.answer(query, context));
        try {
            ProviderResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ProviderResult.failure(FailureReason.MALFORMED_RESPONSE, "provider returned no result");
            }
            if (result instanceof ProviderResult.Success success && success.answer() == null) {
                return ProviderResult.failure(FailureReason.MALFORMED_RESPONSE, "provider returned an empty answer");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProviderResult.failure(FailureReason.TIMEOUT, "no answer within " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.debug("Provider {} raised instead of returning a failure", provider.name(), cause);
            return ProviderResult.failure(FailureReason.MALFORMED_RESPONSE, cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProviderResult.failure(FailureReason.TIMEOUT, "interrupted while waiting");
        }
    }

    private DispatchOutcome lastResort(String query, List<ProviderAttempt> failures, long dispatchStart) {
        MatchResult match = matcher.match(query, corpus);
        if (match.matched()) {
            log.debug("Training data match score={} input={}", String.format("%.3f", match.score()), match.example().input());
            return new DispatchOutcome(match.example().output(), AnswerSource.TRAINING_DATA, null, failures,
                    millisSince(dispatchStart));
        }
        log.debug("No training data match, best score={}", String.format("%.3f", match.score()));
        return new DispatchOutcome(AnswerPayload.text(genericResponder.respond(query)),
                AnswerSource.GENERIC_FALLBACK, null, failures, millisSince(dispatchStart));
    }

    private static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static void logOutcome(DispatchOutcome outcome) {
        log.info("dispatch.outcome source={} failedProviders={} elapsedMs={}",
                outcome.sourceTag(),
                outcome.failedAttempts().size(),
                outcome.elapsedMillis());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
