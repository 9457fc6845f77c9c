package com.partassist.chat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.partassist.answer.AnswerPayload;
import com.partassist.auth.CallerIdentity;
import com.partassist.corpus.TrainingCorpus;
import com.partassist.corpus.TrainingExample;
import com.partassist.dispatch.FallbackDispatcher;
import com.partassist.dispatch.GenericFallbackResponder;
import com.partassist.match.MatcherSettings;
import com.partassist.match.SimilarityMatcher;
import com.partassist.provider.ConversationContext;
import com.partassist.provider.FailureReason;
import com.partassist.provider.ProviderAdapter;
import com.partassist.provider.ProviderResult;
import com.partassist.provider.ScriptedProviderAdapter;
import com.partassist.session.SessionState;
import com.partassist.session.SessionStore;
import com.partassist.session.Turn;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatServiceTest {
    private static final CallerIdentity ALICE = new CallerIdentity("alice", Instant.parse("2030-01-01T00:00:00Z"));
    private static final CallerIdentity BOB = new CallerIdentity("bob", Instant.parse("2030-01-01T00:00:00Z"));

    private final SessionStore store = new SessionStore();
    private FallbackDispatcher dispatcher;

    @AfterEach
    void closeDispatcher() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    void shouldAppendQuestionAndAnswerAndReportSource() {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Check the door gasket."));

        TurnResponse response = service.submitTurn("s1", "  My fridge is warm  ", ALICE);

        assertEquals("Check the door gasket.", response.payload().contextText());
        assertEquals("primary", response.sourceTag());
        assertEquals("s1", response.sessionId());
        SessionState state = service.history("s1", ALICE);
        assertEquals(2, state.history().size());
        assertEquals(Turn.user("My fridge is warm"), state.history().get(0));
        assertEquals(Turn.Role.ASSISTANT, state.history().get(1).role());
        assertEquals("refrigerator", state.lastTopic());
    }

    @Test
    void shouldSerializeConcurrentTurnsOnOneSessionInArrivalOrder() throws Exception {
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        ProviderAdapter provider = new ScriptedProviderAdapter("primary", Duration.ofSeconds(10), (query, context) -> {
            if (query.equals("Hi")) {
                firstEntered.countDown();
                try {
                    releaseFirst.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ProviderResult.success(AnswerPayload.text("Hello! Which appliance?"));
            }
            return ProviderResult.success(AnswerPayload.text("Check the door gasket."));
        });
        ChatService service = service(provider);

        Thread first = new Thread(() -> service.submitTurn("s1", "Hi", ALICE));
        Thread second = new Thread(() -> service.submitTurn("s1", "My dishwasher leaks", ALICE));
        first.start();
        assertTrue(firstEntered.await(5, TimeUnit.SECONDS));
        second.start();
        String key = ChatService.sessionKey(ALICE, "s1");
        long deadline = System.currentTimeMillis() + 5_000;
        while (store.queuedTurns(key) == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(1, store.queuedTurns(key));
        releaseFirst.countDown();
        first.join(5_000);
        second.join(5_000);

        List<Turn> history = service.history("s1", ALICE).history();
        assertEquals(4, history.size());
        assertEquals("Hi", history.get(0).content().contextText());
        assertEquals("Hello! Which appliance?", history.get(1).content().contextText());
        assertEquals("My dishwasher leaks", history.get(2).content().contextText());
        assertEquals("Check the door gasket.", history.get(3).content().contextText());
    }

    @Test
    void shouldHandRecentTurnsAndTopicToProviders() {
        ScriptedProviderAdapter provider = ScriptedProviderAdapter.answering("primary", "Noted.");
        ChatService service = service(provider, 2);

        service.submitTurn("s1", "My dishwasher leaks", ALICE);
        service.submitTurn("s1", "It is under the door", ALICE);
        service.submitTurn("s1", "What part do I need", ALICE);

        List<ConversationContext> contexts = provider.contexts();
        assertTrue(contexts.get(0).recentTurns().isEmpty());
        assertNull(contexts.get(0).lastTopic());
        assertEquals("dishwasher", contexts.get(1).lastTopic());
        assertEquals(2, contexts.get(2).recentTurns().size());
        assertEquals("It is under the door", contexts.get(2).recentTurns().get(0).content().contextText());
        assertEquals("dishwasher", contexts.get(2).lastTopic());
    }

    @Test
    void shouldKeepUsersApartEvenWithSameSessionId() {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Noted."));

        service.submitTurn("shared", "Hi", ALICE);
        service.resetSession("shared", BOB);

        assertEquals(2, service.history("shared", ALICE).history().size());
        assertTrue(service.history("shared", BOB).history().isEmpty());
    }

    @Test
    void shouldKeepUsersApartWhenSubjectAndSessionIdContainSeparators() {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Noted."));
        CallerIdentity colonUser = new CallerIdentity("alice:x", Instant.parse("2030-01-01T00:00:00Z"));

        service.submitTurn("x:y", "Hi", ALICE);

        assertTrue(service.history("y", colonUser).history().isEmpty());
        assertNotEquals(ChatService.sessionKey(ALICE, "x:y"), ChatService.sessionKey(colonUser, "y"));
        assertEquals(2, service.history("x:y", ALICE).history().size());
    }

    @Test
    void shouldUseDefaultSessionWhenIdIsBlank() {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Noted."));

        TurnResponse response = service.submitTurn(" ", "Hi", ALICE);

        assertEquals(ChatService.DEFAULT_SESSION_ID, response.sessionId());
        assertEquals(2, service.history(null, ALICE).history().size());
    }

    @Test
    void shouldResetHistoryAndAcknowledge() {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Noted."));
        service.submitTurn("s1", "My fridge is warm", ALICE);

        ResetAcknowledgement ack = service.resetSession("s1", ALICE);

        assertEquals(new ResetAcknowledgement("s1", "reset"), ack);
        SessionState state = service.history("s1", ALICE);
        assertTrue(state.history().isEmpty());
        assertNull(state.lastTopic());
    }

    @Test
    void shouldAnswerFromTrainingDataWhenProvidersFail() {
        ChatService service = service(ScriptedProviderAdapter.failing("primary", FailureReason.UNREACHABLE));

        TurnResponse response = service.submitTurn("s1", "My refrigerator isn't cooling properly", ALICE);

        assertEquals("training-data", response.sourceTag());
        assertEquals("Check condenser coils.", response.payload().contextText());
    }

    @Test
    void shouldRejectBlankMessageWithoutTouchingHistory() {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Noted."));

        assertThrows(IllegalArgumentException.class, () -> service.submitTurn("s1", "   ", ALICE));
        assertThrows(IllegalArgumentException.class, () -> service.submitTurn("s1", "Hi", null));
        assertTrue(service.history("s1", ALICE).history().isEmpty());
    }

    @Test
    void shouldReturnAnswerEvenIfObservedFromAnotherThread() throws Exception {
        ChatService service = service(ScriptedProviderAdapter.answering("primary", "Noted."));
        AtomicReference<TurnResponse> response = new AtomicReference<>();

        Thread worker = new Thread(() -> response.set(service.submitTurn("s2", "Hi", BOB)));
        worker.start();
        worker.join(5_000);

        assertEquals("Noted.", response.get().payload().contextText());
    }

    private ChatService service(ProviderAdapter provider) {
        return service(provider, 10);
    }

    private ChatService service(ProviderAdapter provider, int contextTurns) {
        TrainingCorpus corpus = new TrainingCorpus(List.of(
                new TrainingExample("refrigerator not cooling", AnswerPayload.text("Check condenser coils."))));
        dispatcher = new FallbackDispatcher(List.of(provider), new SimilarityMatcher(MatcherSettings.defaults()),
                corpus, new GenericFallbackResponder("Tell me more."));
        return new ChatService(dispatcher, store, contextTurns);
    }
}
