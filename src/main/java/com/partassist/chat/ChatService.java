package com.partassist.chat;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.partassist.auth.CallerIdentity;
import com.partassist.dispatch.DispatchOutcome;
import com.partassist.dispatch.FallbackDispatcher;
import com.partassist.provider.ConversationContext;
import com.partassist.session.SessionState;
import com.partassist.session.SessionStore;
import com.partassist.session.Turn;

/**
 * Entry point for authenticated callers. One turn runs entirely under its session's lock:
 * load history, dispatch, append the question and the answer.
 */
public class ChatService {
    private static final Logger log = LoggerFactory.getLogger(ChatService.class);
    static final String DEFAULT_SESSION_ID = "default";

    private final FallbackDispatcher dispatcher;
    private final SessionStore sessionStore;
    private final TopicClassifier topicClassifier;
    private final int contextTurns;
    private final Clock clock;

    public ChatService(FallbackDispatcher dispatcher, SessionStore sessionStore, int contextTurns) {
        this(dispatcher, sessionStore, new TopicClassifier(), contextTurns, Clock.systemUTC());
    }

    public ChatService(
            FallbackDispatcher dispatcher,
            SessionStore sessionStore,
            TopicClassifier topicClassifier,
            int contextTurns,
            Clock clock) {
        this.dispatcher = dispatcher;
        this.sessionStore = sessionStore;
        this.topicClassifier = topicClassifier;
        this.contextTurns = Math.max(0, contextTurns);
        this.clock = clock;
    }

    public TurnResponse submitTurn(String sessionId, String message, CallerIdentity caller) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        Query query = new Query(message.strip(), normalizeSessionId(sessionId), clock.instant());
        String key = sessionKey(caller, query.sessionId());

        DispatchOutcome outcome = sessionStore.withSession(key, session -> {
            SessionState state = session.snapshot();
            ConversationContext context = new ConversationContext(state.recentTurns(contextTurns), state.lastTopic());
            DispatchOutcome result = dispatcher.dispatch(query.text(), context);
            session.append(Turn.user(query.text()));
            session.append(Turn.assistant(result.payload()));
            session.lastTopic(topicClassifier.nextTopic(query.text(), state.lastTopic()));
            return result;
        });

        log.debug("Turn complete user={} sessionId={} source={} receivedAt={}",
                caller.subject(), query.sessionId(), outcome.sourceTag(), query.timestamp());
        return new TurnResponse(outcome.payload(), outcome.sourceTag(), query.sessionId());
    }

    public ResetAcknowledgement resetSession(String sessionId, CallerIdentity caller) {
        String normalized = normalizeSessionId(sessionId);
        sessionStore.reset(sessionKey(caller, normalized));
        log.info("Session reset user={} sessionId={}", caller.subject(), normalized);
        return ResetAcknowledgement.reset(normalized);
    }

    public SessionState history(String sessionId, CallerIdentity caller) {
        return sessionStore.getOrCreate(sessionKey(caller, normalizeSessionId(sessionId)));
    }

    /**
     * Store key scoping a session id to its caller. The subject is length-prefixed, so no pair of
     * subject and session id can produce another pair's key.
     */
    static String sessionKey(CallerIdentity caller, String sessionId) {
        if (caller == null) {
            throw new IllegalArgumentException("Caller identity is required");
        }
        String subject = caller.subject();
        return subject.length() + ":" + subject + ":" + sessionId;
    }

    private static String normalizeSessionId(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId;
    }
}
